package max.chess.tactics.quality;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Move;
import max.chess.tactics.see.StaticExchangeEvaluator;

/**
 * Move-ordering style view of a single move: how forcing it is, and whether the evaluation
 * trend favours the mover.
 */
public final class MoveCharacter {
    public static final String FORCING = "forcing";
    public static final String QUIET = "quiet";

    private static final int CHECK_BONUS = 10_000;
    private static final int PROMOTION_BONUS = 8_000;
    private static final int GOOD_CAPTURE_BONUS = 1_000;
    private static final int BAD_CAPTURE_MALUS = 5_000;
    private static final int CASTLING_BONUS = 100;
    private static final int CENTER_BONUS = 50;
    private static final int DEVELOPMENT_BONUS = 30;

    private final AnalysisConfig config;
    private final ScratchBoardPool pool;
    private final StaticExchangeEvaluator see;

    public MoveCharacter(AnalysisConfig config, ScratchBoardPool pool) {
        this.config = config;
        this.pool = pool;
        this.see = new StaticExchangeEvaluator(pool, config);
    }

    public int interestingness(Board board, Move move) {
        Piece piece = board.get(move.from());
        if (piece == null) return 0;
        Piece victim = board.get(move.to());

        int score = 0;
        if (givesCheck(board, move)) {
            score += CHECK_BONUS;
        }
        if (victim != null) {
            // MVV-LVA
            score += victim.value() * 10 - piece.value();
            int exchange = see.evaluateCapture(board, move.from(), move.to());
            if (exchange > 0) score += GOOD_CAPTURE_BONUS;
            else if (exchange < 0) score -= BAD_CAPTURE_MALUS;
        }
        if (isPromotion(piece, move)) {
            score += PROMOTION_BONUS;
        }
        int row = move.to().row, col = move.to().col;
        if (row >= 3 && row <= 4 && col >= 3 && col <= 4) {
            score += CENTER_BONUS;
        }
        if ((piece.type() == PieceType.KNIGHT || piece.type() == PieceType.BISHOP)
                && (move.from().row == 0 || move.from().row == 7)) {
            score += DEVELOPMENT_BONUS;
        }
        if (piece.type() == PieceType.KING && Math.abs(move.to().col - move.from().col) == 2) {
            score += CASTLING_BONUS;
        }
        return score;
    }

    public String category(Board board, Move move) {
        Piece piece = board.get(move.from());
        if (piece == null) return QUIET;
        if (board.get(move.to()) != null || isPromotion(piece, move)) {
            return FORCING;
        }
        return givesCheck(board, move) ? FORCING : QUIET;
    }

    private boolean givesCheck(Board board, Move move) {
        try (PooledBoard scratch = pool.rent(board)) {
            scratch.board().applyMove(move);
            return AttackUtils.givesCheck(scratch.board(), move.to());
        }
    }

    /** Both evaluations White-relative pawns. */
    public boolean isImproving(double currentEval, double previousEval, Color mover) {
        double change = currentEval - previousEval;
        return mover == Color.WHITE ? change > config.improvingDelta : change < -config.improvingDelta;
    }

    public boolean isWorsening(double currentEval, double previousEval, Color mover) {
        double change = currentEval - previousEval;
        return mover == Color.WHITE ? change < -config.improvingDelta : change > config.improvingDelta;
    }

    private static boolean isPromotion(Piece piece, Move move) {
        return piece.type() == PieceType.PAWN && move.to().row == piece.color().promotionRank();
    }
}
