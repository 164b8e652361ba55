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

// Slider lined up through one piece on a valuable enemy piece it could win
public final class XRayDetector implements TacticDetector {

    @Override
    public String name() {
        return "x-ray";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Piece slider = context.movedPiece();
        if (!slider.type().isSliding()) {
            return Optional.empty();
        }
        Board after = context.after();
        for (Direction direction : slider.type().slidingDirections()) {
            IntArrayList ray = AttackUtils.rayFrom(after, context.to(), direction, 2);
            if (ray.size() < 2) continue;
            Square targetSquare = Square.of(ray.getInt(1));
            Piece target = after.get(targetSquare);
            if (target.color() != context.enemy() || target.type() == PieceType.KING) continue;
            if (target.value() < context.config().valuableTargetValue) continue;

            boolean undefended = AttackUtils.countDefenders(after, targetSquare, context.enemy()) == 0;
            if (undefended || target.value() > slider.value()) {
                return Optional.of(Finding.of("x-ray attack", 6, FindingCategory.TACTIC));
            }
        }
        return Optional.empty();
    }
}
