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

/**
 * An enemy piece left as the sole defender of two attacked valuable pieces, one of which
 * the moved piece hits.
 */
public final class OverloadingDetector implements TacticDetector {

    @Override
    public String name() {
        return "overloading";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Board after = context.after();
        for (int d = 0; d < 64; d++) {
            Piece defender = after.get(d);
            if (defender == null || defender.color() != context.enemy()) continue;
            Square defenderSquare = Square.of(d);

            IntArrayList duties = new IntArrayList(2);
            boolean touchesMove = false;
            for (int t = 0; t < 64; t++) {
                Piece guarded = after.get(t);
                if (t == d || guarded == null || guarded.color() != context.enemy()) continue;
                if (guarded.type() == PieceType.KING || guarded.value() < context.config().valuableTargetValue) continue;
                Square square = Square.of(t);
                if (!AttackUtils.canAttack(after, defenderSquare, defender, square)) continue;
                if (AttackUtils.countDefenders(after, square, context.enemy()) != 1) continue;
                if (!AttackUtils.isAttackedBy(after, square, context.color())) continue;
                duties.add(t);
                if (AttackUtils.canAttack(after, context.to(), context.movedPiece(), square)) {
                    touchesMove = true;
                }
            }
            if (duties.size() >= 2 && touchesMove) {
                String first = after.get(duties.getInt(0)).displayName();
                String second = after.get(duties.getInt(1)).displayName();
                return Optional.of(Finding.of("overloads defender of " + first + " and " + second, 8, FindingCategory.TACTIC));
            }
        }
        return Optional.empty();
    }
}
