package max.chess.tactics.common;

// Cached, compare by identity. Row 0 is the 8th rank (FEN order), column 0 is the a-file.
public final class Square {

    private static final Square[] SQUARE_CACHE = new Square[64];
    static {
        for(int row = 0; row < 8; row++) {
            for(int col = 0; col < 8; col++) {
                SQUARE_CACHE[row * 8 + col] = new Square(row, col);
            }
        }
    }

    public static Square of(int row, int col) {
        if(row < 0 || row > 7 || col < 0 || col > 7) {
            // out of the board
            return null;
        }
        return SQUARE_CACHE[row * 8 + col];
    }

    public static Square of(int index) {
        if(index < 0 || index > 63) {
            return null;
        }
        return SQUARE_CACHE[index];
    }

    public static Square fromName(String name) {
        if(name == null || name.length() != 2) {
            throw new IllegalArgumentException("square should be format 'a1' but was " + name);
        }
        char file = name.charAt(0);
        char rank = name.charAt(1);
        if(file < 'a' || file > 'h') {
            throw new IllegalArgumentException("square letter should be in [a-h] but was " + file);
        }
        if(rank < '1' || rank > '8') {
            throw new IllegalArgumentException("square digit should be in [1-8] but was " + rank);
        }
        return of('8' - rank, file - 'a');
    }

    public final int row;
    public final int col;
    public final int index;

    private Square(int row, int col) {
        this.row = row;
        this.col = col;
        this.index = row * 8 + col;
    }

    public Square offset(int dRow, int dCol) {
        return Square.of(row + dRow, col + dCol);
    }

    public Square step(Direction direction) {
        return offset(direction.dRow, direction.dCol);
    }

    public int distance(Square other) {
        return Math.max(Math.abs(row - other.row), Math.abs(col - other.col));
    }

    public char file() {
        return (char) ('a' + col);
    }

    public int rank() {
        return 8 - row;
    }

    public String name() {
        return String.valueOf(file()) + rank();
    }

    @Override
    public boolean equals(Object obj) {
        return obj == this;
    }

    @Override
    public int hashCode() {
        return index;
    }

    @Override
    public String toString() {
        return name();
    }
}
