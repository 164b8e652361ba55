package max.chess.tactics.quality;

import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.FENUtils;
import max.chess.tactics.notation.Move;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class MoveCharacterTest {
    private final MoveCharacter character = new MoveCharacter(AnalysisConfig.DEFAULT, new ScratchBoardPool(2));

    private int score(Board board, String move) {
        return character.interestingness(board, Move.fromAlgebraicNotation(move));
    }

    @Test
    void checksComeFirst() {
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/R3K3 w - - 0 1");
        assertTrue(score(board, "a1a8") > score(board, "a1a2"));
        assertEquals(MoveCharacter.FORCING, character.category(board, Move.fromAlgebraicNotation("a1a8")));
        assertEquals(MoveCharacter.QUIET, character.category(board, Move.fromAlgebraicNotation("a1a2")));
    }

    @Test
    void losingCaptureRanksBelowQuietMove() {
        Board board = FENUtils.getBoardFrom("4k3/8/4p3/3n4/8/8/8/3QK3 w - - 0 1");
        assertTrue(score(board, "d1d5") < score(board, "d1d2"));
        assertEquals(MoveCharacter.FORCING, character.category(board, Move.fromAlgebraicNotation("d1d5")));
    }

    @Test
    void promotionIsForcing() {
        Board board = FENUtils.getBoardFrom("8/4P3/8/8/8/k7/8/4K3 w - - 0 1");
        Move promotion = Move.fromAlgebraicNotation("e7e8q");
        assertTrue(character.interestingness(board, promotion) >= 8_000);
        assertEquals(MoveCharacter.FORCING, character.category(board, promotion));
    }

    @Test
    void castlingAndDevelopmentBonuses() {
        Board board = FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/1N2K2R w - - 0 1");
        assertEquals(100, score(board, "e1g1"));
        assertEquals(30, score(board, "b1c3"));
    }

    @Test
    void trendFromEachSide() {
        assertTrue(character.isImproving(1.0, 0.2, Color.WHITE));
        assertTrue(character.isImproving(-1.0, -0.2, Color.BLACK));
        assertTrue(character.isWorsening(1.0, 0.2, Color.BLACK));
        assertFalse(character.isImproving(0.3, 0.2, Color.WHITE));
        assertFalse(character.isWorsening(0.3, 0.2, Color.WHITE));
    }
}
