package max.chess.tactics.detect.pattern;

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
 * Knight check on a king walled in by its own pieces. The wall must hold {@code smotheredMinBlockers}
 * pieces, or every neighbouring square on the edge of the board, and the knight must be safe.
 */
public final class SmotheredMateDetector implements TacticDetector {

    @Override
    public String name() {
        return "smothered-mate";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        if (context.movedPiece().type() != PieceType.KNIGHT) {
            return Optional.empty();
        }
        Board after = context.after();
        Square king = after.findKing(context.enemy());
        if (king == null || !AttackUtils.canAttack(after, context.to(), context.movedPiece(), king)) {
            return Optional.empty();
        }
        if (!AttackUtils.kingEscapeSquares(after, context.enemy(), context.pool()).isEmpty()) {
            return Optional.empty();
        }
        if (AttackUtils.isAttackedBy(after, context.to(), context.enemy())) {
            return Optional.empty();
        }
        int neighbours = 0;
        int ownAround = 0;
        for (Direction direction : Direction.values()) {
            Square square = king.step(direction);
            if (square == null) continue;
            neighbours++;
            Piece piece = after.get(square);
            if (piece != null && piece.color() == context.enemy()) {
                ownAround++;
            }
        }
        if (ownAround >= Math.min(context.config().smotheredMinBlockers, neighbours)) {
            return Optional.of(Finding.check("smothered mate", 11, FindingCategory.MATE_PATTERN));
        }
        return Optional.empty();
    }
}
