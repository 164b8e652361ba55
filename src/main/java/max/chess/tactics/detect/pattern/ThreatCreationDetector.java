package max.chess.tactics.detect.pattern;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.Optional;

// A cheaper piece newly hitting a more valuable one
public final class ThreatCreationDetector implements TacticDetector {

    @Override
    public String name() {
        return "threat-creation";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        int movedValue = context.movedPiece().value();
        IntArrayList attacked = context.attackedByMovedPiece();
        for (int i = 0; i < attacked.size(); i++) {
            Square square = Square.of(attacked.getInt(i));
            Piece target = context.after().get(square);
            if (target.type() == PieceType.KING || target.value() <= movedValue) continue;
            if (!AttackUtils.isAttackedBy(context.before(), square, context.color())) {
                return Optional.of(Finding.of("creates threat on " + target.displayName(), 10, FindingCategory.THREAT));
            }
        }
        return Optional.empty();
    }
}
