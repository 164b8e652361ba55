package max.chess.tactics.common;

public enum PieceType {
    PAWN(1, "pawn", 'p'),
    KNIGHT(3, "knight", 'n'),
    BISHOP(3, "bishop", 'b'),
    ROOK(5, "rook", 'r'),
    QUEEN(9, "queen", 'q'),
    KING(100, "king", 'k');

    public static final PieceType[] VALUES = PieceType.values();

    public final int value;
    public final String displayName;
    public final char letter;

    PieceType(int value, String displayName, char letter) {
        this.value = value;
        this.displayName = displayName;
        this.letter = letter;
    }

    public boolean isSliding() {
        return switch (this) {
            case BISHOP, ROOK, QUEEN -> true;
            case PAWN, KNIGHT, KING -> false;
        };
    }

    public boolean isMinorOrBetter() {
        return switch (this) {
            case KNIGHT, BISHOP, ROOK, QUEEN -> true;
            case PAWN, KING -> false;
        };
    }

    public Direction[] slidingDirections() {
        return switch (this) {
            case BISHOP -> Direction.DIAGONALS;
            case ROOK -> Direction.ORTHOGONALS;
            case QUEEN -> Direction.ALL;
            case PAWN, KNIGHT, KING -> Direction.NONE;
        };
    }

    public static PieceType fromLetter(char letter) {
        return switch (letter) {
            case 'p', 'P' -> PAWN;
            case 'n', 'N' -> KNIGHT;
            case 'b', 'B' -> BISHOP;
            case 'r', 'R' -> ROOK;
            case 'q', 'Q' -> QUEEN;
            case 'k', 'K' -> KING;
            default -> throw new IllegalArgumentException("Unknown piece letter " + letter);
        };
    }

    public static PieceType promotionFromLetter(char letter) {
        PieceType pieceType = fromLetter(letter);
        if (pieceType == PAWN || pieceType == KING) {
            throw new IllegalArgumentException("Cannot promote to " + pieceType.displayName);
        }
        return pieceType;
    }
}
