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

public final class DoubleAttackDetector implements TacticDetector {

    @Override
    public String name() {
        return "double-attack";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        IntArrayList attacked = context.attackedByMovedPiece();
        if (attacked.size() < 2) {
            return Optional.empty();
        }
        Board after = context.after();
        boolean hasKing = false;
        int valuable = 0;
        boolean winnable = false;
        for (int i = 0; i < attacked.size(); i++) {
            Square square = Square.of(attacked.getInt(i));
            Piece target = after.get(square);
            if (target.type() == PieceType.KING) {
                hasKing = true;
                continue;
            }
            if (target.value() < context.config().valuableTargetValue) continue;
            valuable++;
            if (isWinnable(context, square, target)) {
                winnable = true;
            }
        }
        if (!winnable) {
            return Optional.empty();
        }
        if (hasKing && valuable >= 1) {
            return Optional.of(Finding.check("double attack: check and wins material", 8, FindingCategory.TACTIC));
        }
        if (valuable >= 2) {
            return Optional.of(Finding.of("double attack on multiple pieces", 6, FindingCategory.TACTIC));
        }
        return Optional.empty();
    }

    // Undefended, or worth more than the attacker: defended-and-losing trades do not count
    private static boolean isWinnable(TacticContext context, Square square, Piece target) {
        return AttackUtils.countDefenders(context.after(), square, context.enemy()) == 0
                || target.value() > context.movedPiece().value();
    }
}
