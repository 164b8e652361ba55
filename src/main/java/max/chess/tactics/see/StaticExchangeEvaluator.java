package max.chess.tactics.see;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.Square;
import max.chess.tactics.config.AnalysisConfig;

/**
 * Static exchange evaluation on a single square, swap-list style: every capture pushes
 * {@code gain[d] = value on square - gain[d-1]}, then the list is folded back so each side
 * stops where it suits it best.
 * <p>
 * Unlike a plain attacker scan, a recapture is only counted when it leaves the recapturing
 * side's king safe, which rules out pinned pieces and recaptures that ignore a check.
 */
public final class StaticExchangeEvaluator {
    // a square can be hit by at most 16 pieces, plus the initial capture
    private static final int MAX_DEPTH = 34;

    private final ScratchBoardPool pool;
    private final AnalysisConfig config;

    public StaticExchangeEvaluator(ScratchBoardPool pool, AnalysisConfig config) {
        this.pool = pool;
        this.config = config;
    }

    /**
     * Net material won by {@code attackerColor} after capturing on {@code target} with the piece on
     * {@code source} and the best sequence of recaptures that follows. 0 when the target is empty or
     * the board is too broken to evaluate.
     */
    public int evaluateExchange(Board board, Square target, Piece attackerPiece, Color attackerColor, Square source) {
        try {
            Piece victim = board.get(target);
            if (victim == null) {
                return 0;
            }
            try (PooledBoard scratch = pool.rent(board)) {
                return swap(scratch.board(), target, attackerPiece, attackerColor, source, victim);
            }
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("SEE failed on " + target + " from " + source + ": " + e);
            }
            return 0;
        }
    }

    /** Exchange value of the move {@code source -> target} using the piece standing on {@code source}. */
    public int evaluateCapture(Board board, Square source, Square target) {
        Piece attacker = board.get(source);
        if (attacker == null) {
            return 0;
        }
        return evaluateExchange(board, target, attacker, attacker.color(), source);
    }

    private int swap(Board scratch, Square target, Piece attackerPiece, Color attackerColor, Square source, Piece victim) {
        final int[] gain = new int[MAX_DEPTH];
        int d = 0;
        gain[0] = victim.value();

        scratch.clear(source);
        scratch.set(target, attackerPiece);
        int onSquareValue = attackerPiece.value();
        Color side = attackerColor.getOppositeColor();

        while (d < MAX_DEPTH - 1) {
            Square from = leastValuableLegalAttacker(scratch, target, side);
            if (from == null) break;

            gain[++d] = onSquareValue - gain[d - 1];
            // neither side can improve by going on
            if (Math.max(-gain[d - 1], gain[d]) < 0) break;

            Piece capturer = scratch.get(from);
            scratch.clear(from);
            scratch.set(target, capturer);
            onSquareValue = capturer.value();
            side = side.getOppositeColor();
        }

        while (d > 0) {
            gain[d - 1] = -Math.max(-gain[d - 1], gain[d]);
            d--;
        }
        return gain[0];
    }

    private static Square leastValuableLegalAttacker(Board scratch, Square target, Color side) {
        IntArrayList attackers = AttackUtils.attackersOf(scratch, target, side);
        Square best = null;
        int bestValue = Integer.MAX_VALUE;
        for (int i = 0; i < attackers.size(); i++) {
            Square from = Square.of(attackers.getInt(i));
            Piece piece = scratch.get(from);
            if (piece.value() < bestValue && isLegalRecapture(scratch, from, target, side)) {
                best = from;
                bestValue = piece.value();
            }
        }
        return best;
    }

    // Plays the recapture on the scratch board and takes it back
    private static boolean isLegalRecapture(Board scratch, Square from, Square target, Color side) {
        Piece moving = scratch.get(from);
        Piece captured = scratch.get(target);
        scratch.clear(from);
        scratch.set(target, moving);
        try {
            Square king = scratch.findKing(side);
            return king == null || !AttackUtils.isAttackedBy(scratch, king, side.getOppositeColor());
        } finally {
            scratch.set(from, moving);
            scratch.set(target, captured);
        }
    }
}
