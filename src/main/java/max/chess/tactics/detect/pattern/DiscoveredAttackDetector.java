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
 * A friendly slider whose line to an enemy piece was closed by the moved piece and is open now.
 * Only kings, rooks and queens are worth announcing as discovered targets.
 */
public final class DiscoveredAttackDetector implements TacticDetector {
    private static final int HEAVY_PIECE_VALUE = 5;

    @Override
    public String name() {
        return "discovered-attack";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Board after = context.after();
        Board before = context.before();
        for (int i = 0; i < 64; i++) {
            Square sliderSquare = Square.of(i);
            if (sliderSquare == context.to()) continue;
            Piece slider = after.get(i);
            if (slider == null || slider.color() != context.color() || !slider.type().isSliding()) continue;

            for (int j = 0; j < 64; j++) {
                Piece target = after.get(j);
                if (target == null || target.color() != context.enemy()) continue;
                Square targetSquare = Square.of(j);
                if (!AttackUtils.canAttack(after, sliderSquare, slider, targetSquare)) continue;
                if (AttackUtils.canAttack(before, sliderSquare, slider, targetSquare)) continue;
                if (!AttackUtils.isBetween(sliderSquare, targetSquare, context.from())) continue;

                if (target.type() == PieceType.KING) {
                    return Optional.of(discoveredCheck(context));
                }
                if (target.value() >= HEAVY_PIECE_VALUE) {
                    return Optional.of(Finding.of("discovered attack on " + target.displayName(), 9, FindingCategory.TACTIC));
                }
            }
        }
        return Optional.empty();
    }

    private static Finding discoveredCheck(TacticContext context) {
        IntArrayList attacked = context.attackedByMovedPiece();
        for (int k = 0; k < attacked.size(); k++) {
            Piece hit = context.after().get(attacked.getInt(k));
            if (hit.type() != PieceType.KING && hit.value() >= HEAVY_PIECE_VALUE) {
                return Finding.check("discovered check, wins " + hit.displayName(), 10, FindingCategory.CHECK);
            }
        }
        return Finding.check("discovered check", 9, FindingCategory.CHECK);
    }
}
