package max.chess.tactics.detect.pattern;

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

public final class PromotionThreatDetector implements TacticDetector {

    @Override
    public String name() {
        return "promotion-threat";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Piece piece = context.movedPiece();
        if (piece.type() != PieceType.PAWN) {
            return Optional.empty();
        }
        Board after = context.after();
        Square pawn = context.to();
        int distance = Math.abs(context.color().promotionRank() - pawn.row);
        if (distance == 1) {
            Square next = pawn.offset(context.color().forward(), 0);
            if (after.isEmpty(next) || canCaptureOnto(after, pawn, context.color())) {
                return Optional.of(Finding.of("threatens promotion", 8, FindingCategory.THREAT));
            }
        } else if (distance == 2) {
            Square next = pawn.offset(context.color().forward(), 0);
            if (after.isEmpty(next) && isPassed(after, pawn, context.color())) {
                return Optional.of(Finding.of("advances passed pawn", 6, FindingCategory.THREAT));
            }
        }
        return Optional.empty();
    }

    private static boolean canCaptureOnto(Board board, Square pawn, Color color) {
        for (int dc = -1; dc <= 1; dc += 2) {
            Square diagonal = pawn.offset(color.forward(), dc);
            if (diagonal != null) {
                Piece target = board.get(diagonal);
                if (target != null && target.color() != color) return true;
            }
        }
        return false;
    }

    // No enemy pawn ahead on this file or the neighbouring ones
    static boolean isPassed(Board board, Square pawn, Color color) {
        for (int row = pawn.row + color.forward(); row >= 0 && row < 8; row += color.forward()) {
            for (int dc = -1; dc <= 1; dc++) {
                Square square = Square.of(row, pawn.col + dc);
                if (square == null) continue;
                Piece piece = board.get(square);
                if (piece != null && piece.type() == PieceType.PAWN && piece.color() != color) {
                    return false;
                }
            }
        }
        return true;
    }
}
