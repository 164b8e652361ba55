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

// The captured piece was the only guard of a valuable piece we now attack
public final class RemovalOfDefenderDetector implements TacticDetector {

    @Override
    public String name() {
        return "removal-of-defender";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Piece captured = context.captured();
        if (captured == null) {
            return Optional.empty();
        }
        Board before = context.before();
        Board after = context.after();
        Square capturedOn = context.capturedSquare();
        for (int i = 0; i < 64; i++) {
            Piece guarded = before.get(i);
            if (guarded == null || guarded.color() != context.enemy() || i == capturedOn.index) continue;
            if (guarded.type() == PieceType.KING || guarded.value() < context.config().valuableTargetValue) continue;
            Square square = Square.of(i);
            if (!AttackUtils.canAttack(before, capturedOn, captured, square)) continue;
            if (AttackUtils.countDefenders(before, square, context.enemy()) != 1) continue;

            if (AttackUtils.countDefenders(after, square, context.enemy()) == 0
                    && AttackUtils.isAttackedBy(after, square, context.color())) {
                return Optional.of(Finding.of("removes defender of " + guarded.displayName(), 8, FindingCategory.TACTIC));
            }
        }
        return Optional.empty();
    }
}
