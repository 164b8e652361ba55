package max.chess.tactics.common;

public enum Direction {
    NORTH(-1, 0), SOUTH(1, 0), EAST(0, 1), WEST(0, -1),
    NORTH_EAST(-1, 1), NORTH_WEST(-1, -1), SOUTH_EAST(1, 1), SOUTH_WEST(1, -1);

    static final Direction[] ORTHOGONALS = {NORTH, SOUTH, EAST, WEST};
    static final Direction[] DIAGONALS = {NORTH_EAST, NORTH_WEST, SOUTH_EAST, SOUTH_WEST};
    static final Direction[] ALL = Direction.values();
    static final Direction[] NONE = {};

    public final int dRow;
    public final int dCol;

    Direction(int dRow, int dCol) {
        this.dRow = dRow;
        this.dCol = dCol;
    }

    public boolean isDiagonal() {
        return dRow != 0 && dCol != 0;
    }

    /**
     * Direction of the straight or diagonal line going from {@code from} to {@code to},
     * or null if both squares do not share a line.
     */
    public static Direction between(Square from, Square to) {
        int dr = to.row - from.row;
        int dc = to.col - from.col;
        if (dr == 0 && dc == 0) {
            return null;
        }
        if (dr != 0 && dc != 0 && Math.abs(dr) != Math.abs(dc)) {
            return null;
        }
        int sr = Integer.signum(dr);
        int sc = Integer.signum(dc);
        for (Direction direction : ALL) {
            if (direction.dRow == sr && direction.dCol == sc) {
                return direction;
            }
        }
        return null;
    }
}
