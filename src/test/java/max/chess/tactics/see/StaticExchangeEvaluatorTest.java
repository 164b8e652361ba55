package max.chess.tactics.see;

import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Square;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.FENUtils;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

final class StaticExchangeEvaluatorTest {
    private static ScratchBoardPool pool;
    private static StaticExchangeEvaluator see;

    @BeforeAll
    static void setUp() {
        pool = new ScratchBoardPool(8);
        see = new StaticExchangeEvaluator(pool, AnalysisConfig.DEFAULT);
    }

    private static int capture(String fen, String from, String to) {
        return see.evaluateCapture(FENUtils.getBoardFrom(fen), Square.fromName(from), Square.fromName(to));
    }

    @Test
    void undefendedVictimIsWonOutright() {
        assertEquals(3, capture("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "d1", "d8"));
    }

    @Test
    void equalTradeIsZero() {
        assertEquals(0, capture("4k3/8/4p3/3q4/8/8/8/3QK3 w - - 0 1", "d1", "d5"));
    }

    @Test
    void recaptureThatExposesTheKingIsNotCounted() {
        // cxd6 would leave the king to the rook on e1
        assertEquals(1, capture("4k3/2p5/3p4/8/4N3/8/8/4R1K1 w - - 0 1", "e4", "d6"));
        assertEquals(-2, capture("4k3/2p5/3p4/8/4N3/8/8/6K1 w - - 0 1", "e4", "d6"));
    }

    @Test
    void queenForDefendedKnightLoses() {
        assertEquals(-6, capture("4k3/8/4p3/3n4/8/8/8/3QK3 w - - 0 1", "d1", "d5"));
    }

    @Test
    void pinnedRecapturerDoesNotCount() {
        // the e7 knight defends d5 but is pinned by the e1 rook
        assertEquals(1, capture("4k3/4n3/8/3p4/8/1B6/8/4R1K1 w - - 0 1", "b3", "d5"));
        // same position with the rook off the e-file, the knight takes back
        assertEquals(-2, capture("4k3/4n3/8/3p4/8/1B6/8/R5K1 w - - 0 1", "b3", "d5"));
    }

    @Test
    void sideStopsWhenRecapturingLoses() {
        // pawn takes knight, the queen would lose itself by taking back on a square the rook covers
        assertEquals(3, capture("4k3/8/8/2q5/3n4/4P3/8/3RK3 w - - 0 1", "e3", "d4"));
    }

    @Test
    void unrelatedPiecesDoNotChangeTheResult() {
        int bare = capture("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "d1", "d8");
        int crowded = capture("3b4/p7/7k/8/8/8/7P/3R2K1 w - - 0 1", "d1", "d8");
        assertEquals(bare, crowded);
    }

    @Test
    void emptyTargetIsZero() {
        assertEquals(0, capture("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "d1", "d4"));
        assertEquals(0, capture("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "e4", "d8"));
    }

    @Test
    void inputBoardIsUntouched() {
        Board board = FENUtils.getBoardFrom("4k3/4n3/8/3p4/8/1B6/8/R5K1 w - - 0 1");
        Board copy = board.copy();
        see.evaluateCapture(board, Square.fromName("b3"), Square.fromName("d5"));
        assertEquals(copy, board);
    }
}
