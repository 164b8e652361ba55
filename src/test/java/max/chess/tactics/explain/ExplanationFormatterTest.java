package max.chess.tactics.explain;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class ExplanationFormatterTest {

    @Test
    void beginnerWording() {
        assertEquals("wins knight (wins 3), best move",
                ExplanationFormatter.adjust("wins knight (SEE +3), only good move", ComplexityLevel.BEGINNER));
        assertEquals("captures rook (loses 2)",
                ExplanationFormatter.adjust("captures rook (SEE -2)", ComplexityLevel.BEGINNER));
        assertEquals("attack through a piece, pins bishop to king",
                ExplanationFormatter.adjust("x-ray attack, pins bishop to king (absolute)", ComplexityLevel.BEGINNER));
    }

    @Test
    void intermediateOnlyDropsTheAbsoluteTag() {
        assertEquals("pins knight to king, x-ray attack",
                ExplanationFormatter.adjust("pins knight to king (absolute), x-ray attack", ComplexityLevel.INTERMEDIATE));
    }

    @Test
    void advancedReadersGetTheRawText() {
        String raw = "pins knight to king (absolute), wins knight (SEE +3)";
        assertEquals(raw, ExplanationFormatter.adjust(raw, ComplexityLevel.ADVANCED));
        assertEquals(raw, ExplanationFormatter.adjust(raw, ComplexityLevel.MASTER));
    }

    @Test
    void emptyText() {
        assertEquals("", ExplanationFormatter.adjust("", ComplexityLevel.BEGINNER));
        assertNull(ExplanationFormatter.adjust(null, ComplexityLevel.BEGINNER));
    }
}
