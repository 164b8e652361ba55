package max.chess.tactics.common;

public record Piece(PieceType type, Color color) {
    private static final Piece[] PIECE_CACHE = new Piece[PieceType.VALUES.length * 2];
    static {
        for (PieceType pieceType : PieceType.VALUES) {
            for (Color color : Color.values()) {
                PIECE_CACHE[cacheIndex(pieceType, color)] = new Piece(pieceType, color);
            }
        }
    }

    private static int cacheIndex(PieceType pieceType, Color color) {
        return pieceType.ordinal() * 2 + color.ordinal();
    }

    public static Piece of(PieceType pieceType, Color color) {
        return PIECE_CACHE[cacheIndex(pieceType, color)];
    }

    public static Piece fromFENLetter(char letter) {
        Color color = Character.isUpperCase(letter) ? Color.WHITE : Color.BLACK;
        return of(PieceType.fromLetter(letter), color);
    }

    public char toFENLetter() {
        return color == Color.WHITE ? Character.toUpperCase(type.letter) : type.letter;
    }

    public int value() {
        return type.value;
    }

    public String displayName() {
        return type.displayName;
    }
}
