package max.chess.tactics.detect.pattern;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.common.Direction;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.Optional;

// Reverse pin: the valuable piece is in front and has to step aside.
public final class SkewerDetector implements TacticDetector {

    @Override
    public String name() {
        return "skewer";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Piece attacker = context.movedPiece();
        if (!attacker.type().isSliding()) {
            return Optional.empty();
        }
        Board after = context.after();
        for (Direction direction : attacker.type().slidingDirections()) {
            IntArrayList ray = AttackUtils.rayFrom(after, context.to(), direction, 2);
            if (ray.size() < 2) continue;
            Piece front = after.get(ray.getInt(0));
            Square behindSquare = Square.of(ray.getInt(1));
            Piece behind = after.get(behindSquare);
            if (front.color() != context.enemy() || behind.color() != context.enemy()) continue;
            if (behind.type() == PieceType.KING) continue;

            if (front.type() == PieceType.KING) {
                return Optional.of(Finding.check("skewers king, winning " + behind.displayName(), 9, FindingCategory.TACTIC));
            }
            if (front.value() > behind.value()) {
                boolean undefended = AttackUtils.countDefenders(after, behindSquare, context.enemy()) == 0;
                if (undefended || behind.value() > attacker.value()) {
                    return Optional.of(Finding.of("skewers " + front.displayName() + ", winning " + behind.displayName(), 8, FindingCategory.TACTIC));
                }
            }
        }
        return Optional.empty();
    }
}
