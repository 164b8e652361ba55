package max.chess.tactics.board;

import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.notation.Move;

import java.util.Arrays;

/**
 * Mailbox 8x8 grid. A null cell is empty. Nothing here checks that the position is legal:
 * the analysis code has to cope with any grid it is given.
 */
public final class Board {
    private final Piece[] cells = new Piece[64];

    public Board() {
    }

    public Piece get(Square square) {
        return cells[square.index];
    }

    public Piece get(int index) {
        return cells[index];
    }

    public boolean isEmpty(Square square) {
        return cells[square.index] == null;
    }

    public void set(Square square, Piece piece) {
        cells[square.index] = piece;
    }

    public void clear(Square square) {
        cells[square.index] = null;
    }

    public void clearAll() {
        Arrays.fill(cells, null);
    }

    public void copyFrom(Board other) {
        System.arraycopy(other.cells, 0, cells, 0, 64);
    }

    public Board copy() {
        Board board = new Board();
        board.copyFrom(this);
        return board;
    }

    public Square findKing(Color color) {
        for (int i = 0; i < 64; i++) {
            Piece piece = cells[i];
            if (piece != null && piece.type() == PieceType.KING && piece.color() == color) {
                return Square.of(i);
            }
        }
        return null;
    }

    /**
     * Plays the move on this board: promotion, castling rook hop and en passant capture
     * are inferred from the grid since no game state is kept.
     */
    public void applyMove(Move move) {
        Piece moving = get(move.from());
        if (moving == null) {
            throw new IllegalArgumentException("No piece on " + move.from());
        }
        Piece target = get(move.to());

        clear(move.from());
        if (move.promotion() != null) {
            set(move.to(), Piece.of(move.promotion(), moving.color()));
        } else {
            set(move.to(), moving);
        }

        if (moving.type() == PieceType.KING && Math.abs(move.to().col - move.from().col) == 2) {
            boolean kingSide = move.to().col > move.from().col;
            Square rookFrom = Square.of(move.from().row, kingSide ? 7 : 0);
            Square rookTo = Square.of(move.from().row, kingSide ? 5 : 3);
            Piece rook = get(rookFrom);
            if (rook != null && rook.type() == PieceType.ROOK && rook.color() == moving.color()) {
                clear(rookFrom);
                set(rookTo, rook);
            }
        } else if (target == null) {
            Square passed = enPassantVictim(moving, move);
            if (passed != null) {
                clear(passed);
            }
        }
    }

    /** The piece {@code move} takes, the passed pawn for an en passant capture, null for a quiet move. */
    public Piece capturedBy(Move move) {
        Piece target = get(move.to());
        if (target != null) {
            return target;
        }
        Square passed = enPassantSquare(move);
        return passed == null ? null : get(passed);
    }

    /** Square of the pawn {@code move} takes en passant, null when it is not an en passant capture. */
    public Square enPassantSquare(Move move) {
        Piece moving = get(move.from());
        if (moving == null || get(move.to()) != null) {
            return null;
        }
        return enPassantVictim(moving, move);
    }

    private Square enPassantVictim(Piece moving, Move move) {
        if (moving.type() != PieceType.PAWN || move.from().col == move.to().col) {
            return null;
        }
        Square passed = Square.of(move.from().row, move.to().col);
        Piece passedPawn = get(passed);
        if (passedPawn != null && passedPawn.type() == PieceType.PAWN && passedPawn.color() != moving.color()) {
            return passed;
        }
        return null;
    }

    public Board afterMove(Move move) {
        Board board = copy();
        board.applyMove(move);
        return board;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Board other)) return false;
        return Arrays.equals(cells, other.cells);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(cells);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < 8; row++) {
            for (int col = 0; col < 8; col++) {
                Piece piece = cells[row * 8 + col];
                sb.append(piece == null ? '.' : piece.toFENLetter());
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
