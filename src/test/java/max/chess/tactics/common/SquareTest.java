package max.chess.tactics.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

final class SquareTest {

    @Test
    void namesFollowFenOrder() {
        Square e4 = Square.fromName("e4");
        assertEquals(4, e4.row);
        assertEquals(4, e4.col);
        assertEquals("e4", e4.name());
        assertSame(Square.of(0, 0), Square.fromName("a8"));
        assertSame(Square.of(63), Square.fromName("h1"));
    }

    @Test
    void offBoardIsNull() {
        assertNull(Square.of(8, 0));
        assertNull(Square.of(-1));
        assertNull(Square.fromName("h1").offset(1, 0));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "e", "i4", "e9", "e0", "e44"})
    void rejectsBadNames(String name) {
        assertThrows(IllegalArgumentException.class, () -> Square.fromName(name));
    }

    @Test
    void directionBetweenAlignedSquares() {
        assertEquals(Direction.NORTH_EAST, Direction.between(Square.fromName("a1"), Square.fromName("h8")));
        assertEquals(Direction.SOUTH, Direction.between(Square.fromName("e8"), Square.fromName("e1")));
        assertNull(Direction.between(Square.fromName("a1"), Square.fromName("b3")));
        assertNull(Direction.between(Square.fromName("a1"), Square.fromName("a1")));
    }

    @Test
    void distanceIsKingDistance() {
        assertEquals(7, Square.fromName("a1").distance(Square.fromName("h8")));
        assertEquals(2, Square.fromName("e4").distance(Square.fromName("f6")));
    }

    @Test
    void piecesAreCached() {
        assertSame(Piece.of(PieceType.KNIGHT, Color.WHITE), Piece.fromFENLetter('N'));
        assertEquals('q', Piece.of(PieceType.QUEEN, Color.BLACK).toFENLetter());
        assertThrows(IllegalArgumentException.class, () -> Piece.fromFENLetter('x'));
        assertThrows(IllegalArgumentException.class, () -> PieceType.promotionFromLetter('k'));
    }
}
