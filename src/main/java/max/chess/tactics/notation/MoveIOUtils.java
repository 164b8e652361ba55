package max.chess.tactics.notation;

import max.chess.tactics.board.Board;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;

public class MoveIOUtils {
    public static String writeAlgebraicNotation(Move move) {
        String promotedPiece = move.promotion() == null ? "" : String.valueOf(move.promotion().letter);
        return move.from().name() + move.to().name() + promotedPiece;
    }

    /** Short algebraic-like rendering for logs and the CLI: "Nf3xe5", "e7e8=Q", "O-O". */
    public static String writeReadableNotation(Board board, Move move) {
        Piece piece = board.get(move.from());
        if(piece == null) {
            return writeAlgebraicNotation(move);
        }
        if(piece.type() == PieceType.KING && Math.abs(move.to().col - move.from().col) == 2) {
            return move.to().col > move.from().col ? "O-O" : "O-O-O";
        }
        String take = board.get(move.to()) != null ? "x" : "-";
        String promotion = move.promotion() != null ? "=" + getAlgebraicNotationLetter(move.promotion()) : "";
        return getAlgebraicNotationLetter(piece.type()) + move.from().name() + take + move.to().name() + promotion;
    }

    private static String getAlgebraicNotationLetter(PieceType pieceType) {
        return switch (pieceType) {
            case KING -> "K";
            case PAWN -> "";
            case KNIGHT -> "N";
            case QUEEN -> "Q";
            case ROOK -> "R";
            case BISHOP -> "B";
        };
    }

    /** Strips check/mate marks and annotation glyphs: "Nf7+!" becomes "Nf7". */
    public static String stripAnnotations(String token) {
        int end = token.length();
        while(end > 0 && "+#!?".indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(0, end);
    }
}
