package max.chess.tactics.detect.pattern;

import it.unimi.dsi.fastutil.ints.IntArrayList;
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

// Undefended target of the moved piece that cannot run away
public final class HangingPieceDetector implements TacticDetector {

    @Override
    public String name() {
        return "hanging-piece";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Board after = context.after();
        int attackerValue = context.movedPiece().value();
        boolean weCanBeRecaptured = AttackUtils.isAttackedBy(after, context.to(), context.enemy());
        IntArrayList attacked = context.attackedByMovedPiece();
        for (int i = 0; i < attacked.size(); i++) {
            Square square = Square.of(attacked.getInt(i));
            Piece target = after.get(square);
            if (target.type() == PieceType.KING) continue;
            int targetValue = target.value();
            if (targetValue < attackerValue && targetValue < context.config().valuableTargetValue) continue;
            if (AttackUtils.countDefenders(after, square, context.enemy()) > 0) continue;
            if (!AttackUtils.safeSquaresFor(after, square, context.pool()).isEmpty()) continue;

            if (!weCanBeRecaptured || targetValue > attackerValue) {
                return Optional.of(Finding.of("wins undefended " + target.displayName(), 8, FindingCategory.TACTIC));
            }
        }
        return Optional.empty();
    }
}
