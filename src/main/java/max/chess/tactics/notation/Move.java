package max.chess.tactics.notation;

import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;

public record Move(Square from, Square to, PieceType promotion) {

    public Move(Square from, Square to) {
        this(from, to, null);
    }

    // "e2e4", "e7e8q"
    public static Move fromAlgebraicNotation(String moveCode) {
        if(moveCode == null || (moveCode.length() != 4 && moveCode.length() != 5)) {
            throw new IllegalArgumentException("Move should be 4 or 5 characters like 'e2e4' but was " + moveCode);
        }
        Square from = Square.fromName(moveCode.substring(0, 2));
        Square to = Square.fromName(moveCode.substring(2, 4));
        if(from == to) {
            throw new IllegalArgumentException("Move has identical start and end squares: " + moveCode);
        }
        PieceType promotion = moveCode.length() == 5 ? PieceType.promotionFromLetter(moveCode.charAt(4)) : null;
        return new Move(from, to, promotion);
    }

    @Override
    public String toString() {
        return MoveIOUtils.writeAlgebraicNotation(this);
    }
}
