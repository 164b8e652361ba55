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

/**
 * Moved slider attacking an enemy piece with a more valuable enemy piece right behind it.
 * Pins to the king are absolute. A relative pin is only worth reporting when the piece
 * behind hangs, or when taking it still nets {@code relativePinMinGain} after a recapture.
 */
public final class PinDetector implements TacticDetector {

    @Override
    public String name() {
        return "pin";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Piece pinner = context.movedPiece();
        if (!pinner.type().isSliding()) {
            return Optional.empty();
        }
        Board after = context.after();
        for (Direction direction : pinner.type().slidingDirections()) {
            IntArrayList ray = AttackUtils.rayFrom(after, context.to(), direction, 2);
            if (ray.size() < 2) continue;
            Piece pinned = after.get(ray.getInt(0));
            Square behindSquare = Square.of(ray.getInt(1));
            Piece behind = after.get(behindSquare);
            if (pinned.color() != context.enemy() || behind.color() != context.enemy()) continue;
            if (pinned.type() == PieceType.KING) continue;

            if (behind.type() == PieceType.KING) {
                return Optional.of(Finding.of("pins " + pinned.displayName() + " to king (absolute)", 9, FindingCategory.TACTIC));
            }
            if (behind.value() > pinned.value()) {
                boolean undefended = AttackUtils.countDefenders(after, behindSquare, context.enemy()) == 0;
                int gain = behind.value() - pinner.value();
                if (undefended || gain >= context.config().relativePinMinGain) {
                    return Optional.of(Finding.of("pins " + pinned.displayName() + " to " + behind.displayName(), 8, FindingCategory.TACTIC));
                }
            }
        }
        return Optional.empty();
    }
}
