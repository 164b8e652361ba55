package max.chess.tactics.defense;

import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.FENUtils;
import max.chess.tactics.notation.Move;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefenseAnalyzerTest {
    private final ScratchBoardPool pool = new ScratchBoardPool(4);
    private final DefenseAnalyzer analyzer = new DefenseAnalyzer(AnalysisConfig.DEFAULT, pool);

    private List<String> defenses(String fen, String move) {
        return analyzer.analyzeDefenses(FENUtils.getBoardFrom(fen), Move.fromAlgebraicNotation(move), FENUtils.getSideToMove(fen))
                .stream().map(Defense::description).toList();
    }

    @Test
    void kingStepsOutOfCheck() {
        assertEquals(List.of("gets out of check"), defenses("4r1k1/8/8/8/8/8/8/4K3 w - - 0 1", "e1d1"));
    }

    @Test
    void interpositionIsBothABlockAndACheckEscape() {
        assertEquals(List.of("gets out of check", "blocks attack on king"),
                defenses("4r1k1/8/8/8/8/8/3B4/4K3 w - - 0 1", "d2e3"));
    }

    @Test
    void attackedKnightRunsAway() {
        assertEquals(List.of("saves knight"), defenses("4k3/8/8/3p4/4N3/8/8/4K3 w - - 0 1", "e4g5"));
    }

    @Test
    void knightRunningIntoAnotherAttackIsNotSaved() {
        // f6 is covered by the e7 pawn
        assertFalse(defenses("4k3/4p3/8/3p4/4N3/8/8/4K3 w - - 0 1", "e4f6").contains("saves knight"));
    }

    @Test
    void queenDefendsAttackedKnight() {
        assertEquals(List.of("defends knight on c3"), defenses("4k3/8/8/8/1b6/2N5/8/3QK3 w - - 0 1", "d1d2"));
    }

    @Test
    void luftStopsBackRankMate() {
        List<String> defenses = defenses("r5k1/5ppp/8/8/8/8/5PPP/6K1 w - - 0 1", "h2h3");
        assertFalse(defenses.isEmpty());
        assertEquals("stops mate threat", defenses.get(0));
    }

    @Test
    void quietMoveDefendsNothing() {
        assertTrue(defenses("4k3/8/8/8/8/8/8/R3K3 w - - 0 1", "a1a2").isEmpty());
    }

    @Test
    void wrongColourGivesNothing() {
        Board board = FENUtils.getBoardFrom("4k3/8/8/3p4/4N3/8/8/4K3 w - - 0 1");
        assertTrue(analyzer.analyzeDefenses(board, Move.fromAlgebraicNotation("e4g5"), Color.BLACK).isEmpty());
    }

    @Test
    void neverMoreThanTwo() {
        assertTrue(defenses("4r1k1/8/8/8/8/8/3B4/4K3 w - - 0 1", "d2e3").size() <= 2);
    }
}
