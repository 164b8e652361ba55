package max.chess.tactics.sacrifice;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Evaluation;
import max.chess.tactics.notation.Move;
import max.chess.tactics.see.StaticExchangeEvaluator;

import java.util.Optional;

/**
 * Separates fair trades and winning captures from real sacrifices, and flags the sacrifices
 * that deserve a "brilliant" label. Evaluations are read from the mover's side.
 */
public final class SacrificeClassifier {

    private final AnalysisConfig config;
    private final ScratchBoardPool pool;
    private final StaticExchangeEvaluator see;

    public SacrificeClassifier(AnalysisConfig config, ScratchBoardPool pool) {
        this.config = config;
        this.pool = pool;
        this.see = new StaticExchangeEvaluator(pool, config);
    }

    /**
     * @param before           position before the move
     * @param exchangeValue    SEE of the move, ignored for quiet moves
     * @param evaluationBefore engine evaluation of the position before the move, if known
     * @param evaluationAfter  engine evaluation after the move, if known
     */
    public SacrificeVerdict classify(Board before, Move move, int exchangeValue,
                                     Optional<Evaluation> evaluationBefore,
                                     Optional<Evaluation> evaluationAfter) {
        try {
            Piece piece = before.get(move.from());
            if (piece == null || piece.type() == PieceType.KING) {
                return SacrificeVerdict.NONE;
            }
            Color us = piece.color();
            Piece captured = before.capturedBy(move);
            Optional<Double> scoreBefore = evaluationBefore.map(e -> e.forMover(us, config.mateScorePawns));
            Optional<Double> scoreAfter = evaluationAfter.map(e -> e.forMover(us, config.mateScorePawns));

            try (PooledBoard scratch = pool.rent(before)) {
                Board after = scratch.board();
                after.applyMove(move);
                SacrificeVerdict verdict = captured == null
                        ? classifyQuiet(after, move, piece, scoreAfter)
                        : classifyCapture(before, move, piece, captured, exchangeValue, scoreAfter);

                boolean candidate = verdict.sacrifice()
                        || verdict.kind() == SacrificeKind.NONE
                        || verdict.kind() == SacrificeKind.LOSING_CAPTURE;
                if (candidate && isBrilliant(after, move, piece, captured, scoreBefore, scoreAfter)) {
                    return SacrificeVerdict.sacrifice(SacrificeKind.BRILLIANT, "brilliant " + piece.displayName() + " sacrifice");
                }
                return verdict;
            }
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("Sacrifice classification failed on " + move + ": " + e);
            }
            return SacrificeVerdict.NONE;
        }
    }

    private SacrificeVerdict classifyCapture(Board before, Move move, Piece piece, Piece captured,
                                             int exchangeValue, Optional<Double> scoreAfter) {
        Color them = piece.color().getOppositeColor();
        boolean targetDefended = AttackUtils.countDefenders(before, move.to(), them) > 0;

        if (piece.type() == PieceType.ROOK
                && (captured.type() == PieceType.KNIGHT || captured.type() == PieceType.BISHOP)
                && targetDefended && exchangeValue < -1
                && scoreAfter.isPresent() && scoreAfter.get() > config.exchangeSacrificeFloor) {
            return SacrificeVerdict.sacrifice(SacrificeKind.EXCHANGE_SACRIFICE, "exchange sacrifice (rook for minor piece)");
        }
        if (exchangeValue <= -config.sacrificeMaterial && targetDefended
                && scoreAfter.isPresent() && scoreAfter.get() > config.compensationThreshold) {
            return SacrificeVerdict.sacrifice(SacrificeKind.SACRIFICE, sacrificeWording(piece.type()));
        }
        if (exchangeValue > 0) {
            boolean sameValueTrade = targetDefended && piece.value() == captured.value();
            return SacrificeVerdict.of(sameValueTrade ? SacrificeKind.FAIR_TRADE : SacrificeKind.WINNING_CAPTURE);
        }
        if (exchangeValue == 0) {
            return SacrificeVerdict.of(SacrificeKind.FAIR_TRADE);
        }
        return SacrificeVerdict.of(SacrificeKind.LOSING_CAPTURE);
    }

    // A quiet move leaving the piece en prise for enough material, with the engine still happy
    private SacrificeVerdict classifyQuiet(Board after, Move move, Piece piece, Optional<Double> scoreAfter) {
        if (scoreAfter.isEmpty() || scoreAfter.get() <= config.compensationThreshold) {
            return SacrificeVerdict.NONE;
        }
        if (opponentGain(after, move.to()) >= config.sacrificeMaterial) {
            return SacrificeVerdict.sacrifice(SacrificeKind.SACRIFICE, sacrificeWording(after.get(move.to()).type()));
        }
        return SacrificeVerdict.NONE;
    }

    private boolean isBrilliant(Board after, Move move, Piece piece, Piece captured,
                                Optional<Double> scoreBefore, Optional<Double> scoreAfter) {
        if (!piece.type().isMinorOrBetter() || scoreAfter.isEmpty()) {
            return false;
        }
        if (scoreBefore.isPresent() && scoreBefore.get() >= config.decisiveAdvantage) {
            return false;
        }
        if (scoreAfter.get() <= -config.badPosition) {
            return false;
        }
        int capturedValue = captured == null ? 0 : captured.value();
        if (piece.value() - capturedValue < config.sacrificeMaterial) {
            return false;
        }
        Square target = move.to();
        Color us = piece.color();
        Color them = us.getOppositeColor();
        // the piece has to be en prise
        if (!AttackUtils.isAttackedBy(after, target, them)) {
            return false;
        }
        if (AttackUtils.countDefenders(after, target, us) > 0) {
            return false;
        }
        IntArrayList attackers = AttackUtils.attackersOf(after, target, them);
        for (int i = 0; i < attackers.size(); i++) {
            if (after.get(attackers.getInt(i)).type() == PieceType.PAWN) {
                return false;
            }
        }
        return true;
    }

    // Best the opponent can get by taking on `target` with its cheapest attacker
    private int opponentGain(Board after, Square target) {
        Piece piece = after.get(target);
        Color them = piece.color().getOppositeColor();
        IntArrayList attackers = AttackUtils.attackersOf(after, target, them);
        int best = 0;
        for (int i = 0; i < attackers.size(); i++) {
            Square from = Square.of(attackers.getInt(i));
            int gain = see.evaluateExchange(after, target, after.get(from), them, from);
            best = Math.max(best, gain);
        }
        return best;
    }

    private static String sacrificeWording(PieceType pieceType) {
        return switch (pieceType) {
            case QUEEN -> "queen sacrifice";
            case ROOK -> "rook sacrifice";
            case KNIGHT, BISHOP -> "piece sacrifice";
            case PAWN, KING -> "pawn sacrifice";
        };
    }
}
