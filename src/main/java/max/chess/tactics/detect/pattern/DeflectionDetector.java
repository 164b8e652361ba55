package max.chess.tactics.detect.pattern;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.Optional;

/**
 * The moved piece can only be taken by an enemy piece that is also the sole guard of a square
 * next to its king, or of a valuable piece, that we attack. Taking pulls the guard away.
 */
public final class DeflectionDetector implements TacticDetector {

    @Override
    public String name() {
        return "deflection";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Board after = context.after();
        IntArrayList takers = AttackUtils.attackersOf(after, context.to(), context.enemy());
        Square enemyKing = after.findKing(context.enemy());
        for (int i = 0; i < takers.size(); i++) {
            Square takerSquare = Square.of(takers.getInt(i));
            Piece taker = after.get(takerSquare);
            if (taker.type() == PieceType.KING) continue;

            for (int s = 0; s < 64; s++) {
                Square duty = Square.of(s);
                if (duty == context.to() || duty == takerSquare) continue;
                if (!isKeySquare(context, after, duty, enemyKing)) continue;
                if (!AttackUtils.canAttack(after, takerSquare, taker, duty)) continue;
                if (!AttackUtils.isAttackedBy(after, duty, context.color())) continue;
                boolean nextToKing = enemyKing != null && duty.distance(enemyKing) == 1;
                int guards = nextToKing
                        ? guardsOtherThanKing(after, duty, context.enemy())
                        : AttackUtils.countDefenders(after, duty, context.enemy());
                if (guards == 1) {
                    return Optional.of(Finding.of("deflects key defender", 7, FindingCategory.TACTIC));
                }
            }
        }
        return Optional.empty();
    }

    // Around its own king the king is always a guard, only the other pieces can be pulled away
    private static int guardsOtherThanKing(Board board, Square square, Color color) {
        IntArrayList guards = AttackUtils.attackersOf(board, square, color);
        int count = 0;
        for (int i = 0; i < guards.size(); i++) {
            if (board.get(guards.getInt(i)).type() != PieceType.KING) count++;
        }
        return count;
    }

    private static boolean isKeySquare(TacticContext context, Board after, Square square, Square enemyKing) {
        if (enemyKing != null && square.distance(enemyKing) == 1) {
            Piece occupant = after.get(square);
            return occupant == null || occupant.color() != context.enemy();
        }
        Piece occupant = after.get(square);
        return occupant != null
                && occupant.color() == context.enemy()
                && occupant.type() != PieceType.KING
                && occupant.value() >= context.config().valuableTargetValue;
    }
}
