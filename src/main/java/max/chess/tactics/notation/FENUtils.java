package max.chess.tactics.notation;

import max.chess.tactics.board.Board;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.Square;

// Only the piece placement and the side to move matter here, the other FEN fields are accepted and ignored.
public class FENUtils {

    // https://en.wikipedia.org/wiki/Forsyth%E2%80%93Edwards_Notation
    public static Board getBoardFrom(String fen) {
        if(fen == null || fen.isBlank()) {
            throw new IllegalArgumentException("Invalid FEN record: empty");
        }
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length != 1 && fenFields.length != 6) {
            throw new IllegalArgumentException("Invalid FEN record: expected 1 or 6 fields but got " + fenFields.length);
        }
        Board board = new Board();
        injectPiecePlacement(board, fenFields[0]);
        return board;
    }

    public static Color getSideToMove(String fen) {
        String[] fenFields = fen.trim().split("\\s+");
        if(fenFields.length < 2) {
            return Color.WHITE;
        }
        return switch (fenFields[1]) {
            case "w" -> Color.WHITE;
            case "b" -> Color.BLACK;
            default -> throw new IllegalArgumentException("Invalid FEN side to move: " + fenFields[1]);
        };
    }

    public static String getFENFromBoard(Board board) {
        StringBuilder fen = new StringBuilder();
        for(int row = 0 ; row < 8 ; row++) {
            int emptySpaceCounter = 0;
            if(row != 0) {
                fen.append('/');
            }
            for(int col = 0 ; col < 8 ; col++) {
                Piece piece = board.get(Square.of(row, col));
                if(piece == null) {
                    emptySpaceCounter++;
                    continue;
                }
                if(emptySpaceCounter != 0) {
                    fen.append(emptySpaceCounter);
                    emptySpaceCounter = 0;
                }
                fen.append(piece.toFENLetter());
            }

            if(emptySpaceCounter != 0) {
                fen.append(emptySpaceCounter);
            }
        }
        return fen.toString();
    }

    private static void injectPiecePlacement(Board board, String piecePlacement) {
        String[] piecePlacementRows = piecePlacement.split("/");
        if(piecePlacementRows.length != 8) {
            throw new IllegalArgumentException("Invalid FEN placement: expected 8 ranks but got " + piecePlacementRows.length);
        }
        for(int row = 0; row < 8; row++) {
            int col = 0;
            for(char character : piecePlacementRows[row].toCharArray()) {
                switch (character) {
                    case '1','2','3','4','5','6','7','8' -> col += character - '0';
                    default -> {
                        if(col > 7) {
                            throw new IllegalArgumentException("Invalid FEN placement: rank " + (8 - row) + " is too long");
                        }
                        board.set(Square.of(row, col), Piece.fromFENLetter(character));
                        col++;
                    }
                }
            }
            if(col != 8) {
                throw new IllegalArgumentException("Invalid FEN placement: rank " + (8 - row) + " has " + col + " squares");
            }
        }
    }
}
