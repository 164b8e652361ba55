package max.chess.tactics.detect.pattern;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;
import max.chess.tactics.notation.Evaluation;

import java.util.Optional;

/**
 * Forced and singular moves. The legality and multi-PV facts come from the engine side,
 * only the single king escape out of check is worked out here.
 */
public final class SingularMoveDetector implements TacticDetector {

    @Override
    public String name() {
        return "singular";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        if (context.onlyLegalReply()) {
            return Optional.of(Finding.of("only move", 12, FindingCategory.FORCED));
        }
        if (isForcedKingReply(context)) {
            return Optional.of(Finding.of("forced reply", 12, FindingCategory.FORCED));
        }
        if (isSingular(context)) {
            return Optional.of(Finding.of("only good move", 11, FindingCategory.FORCED));
        }
        return Optional.empty();
    }

    private static boolean isForcedKingReply(TacticContext context) {
        if (context.piece().type() != PieceType.KING || !AttackUtils.isInCheck(context.before(), context.color())) {
            return false;
        }
        var escapes = AttackUtils.kingEscapeSquares(context.before(), context.color(), context.pool());
        return escapes.size() == 1 && escapes.getInt(0) == context.to().index;
    }

    private static boolean isSingular(TacticContext context) {
        if (context.pvLines().size() < 2) {
            return false;
        }
        Optional<Evaluation> best = context.evaluation();
        Optional<Evaluation> second = context.secondBestEvaluation();
        if (best.isEmpty() || second.isEmpty()) {
            return false;
        }
        double mateScore = context.config().mateScorePawns;
        double gap = Math.abs(best.get().forMover(context.color(), mateScore)
                - second.get().forMover(context.color(), mateScore));
        return gap >= context.config().singularGap;
    }
}
