package max.chess.tactics.common;

public enum Color {
    BLACK, WHITE;

    public Color getOppositeColor() {
        if(this == WHITE) {
            return BLACK;
        } else {
            return WHITE;
        }
    }

    // Row delta of a pawn step; row 0 is the 8th rank
    public int forward() {
        return this == WHITE ? -1 : 1;
    }

    public int backRank() {
        return this == WHITE ? 7 : 0;
    }

    public int promotionRank() {
        return this == WHITE ? 0 : 7;
    }

    public boolean isWhite() {
        return this == WHITE;
    }
}
