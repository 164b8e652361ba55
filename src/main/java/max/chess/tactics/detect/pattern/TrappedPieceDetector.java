package max.chess.tactics.detect.pattern;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.Optional;

/**
 * An enemy piece near the move, attacked and profitably capturable, with no safe square left,
 * that still had one before the move.
 */
public final class TrappedPieceDetector implements TacticDetector {

    @Override
    public String name() {
        return "trapped-piece";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Board after = context.after();
        for (int i = 0; i < 64; i++) {
            Piece target = after.get(i);
            if (target == null || target.color() != context.enemy()) continue;
            if (target.type() == PieceType.KING || target.type() == PieceType.PAWN) continue;
            if (target.value() < context.config().valuableTargetValue) continue;
            Square square = Square.of(i);
            if (!isNearMove(context, square)) continue;

            int lowestAttacker = AttackUtils.lowestAttackerValue(after, square, context.color());
            if (lowestAttacker == 0) continue;
            boolean defended = AttackUtils.countDefenders(after, square, context.enemy()) > 0;
            if (defended && lowestAttacker >= target.value()) continue;

            if (!AttackUtils.safeSquaresFor(after, square, context.pool()).isEmpty()) continue;
            if (target.equals(context.before().get(square))
                    && AttackUtils.safeSquaresFor(context.before(), square, context.pool()).isEmpty()) {
                continue;
            }
            return Optional.of(Finding.of("traps " + target.displayName(), 8, FindingCategory.TACTIC));
        }
        return Optional.empty();
    }

    static boolean isNearMove(TacticContext context, Square square) {
        return square.distance(context.to()) <= context.config().proximityRadius
                || AttackUtils.canAttack(context.after(), context.to(), context.movedPiece(), square);
    }
}
