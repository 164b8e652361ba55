package max.chess.tactics.board.pool;

import max.chess.tactics.board.Board;
import max.chess.tactics.common.Square;
import max.chess.tactics.notation.FENUtils;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ScratchBoardPoolTest {
    private static final String FEN = "r3k2r/8/8/8/8/8/8/R3K2R w KQkq - 0 1";

    @Test
    void rentedBoardIsAPrivateCopy() {
        ScratchBoardPool pool = new ScratchBoardPool(4);
        Board source = FENUtils.getBoardFrom(FEN);
        try (PooledBoard scratch = pool.rent(source)) {
            assertEquals(source, scratch.board());
            scratch.board().clear(Square.fromName("a1"));
            assertNotEquals(source, scratch.board());
        }
        assertNotNull(source.get(Square.fromName("a1")), "Source board must not see scratch changes");
    }

    @Test
    void boardComesBackOnClose() {
        ScratchBoardPool pool = new ScratchBoardPool(4);
        Board source = FENUtils.getBoardFrom(FEN);
        PooledBoard scratch = pool.rent(source);
        assertEquals(0, pool.idleSize());
        scratch.close();
        assertEquals(1, pool.idleSize());
        scratch.close();
        assertEquals(1, pool.idleSize(), "Closing twice must not return the board twice");
        assertThrows(IllegalStateException.class, scratch::board);

        // a reused board holds the new source, nothing from its previous rental
        Board empty = new Board();
        try (PooledBoard reused = pool.rent(empty)) {
            assertEquals(empty, reused.board());
        }
    }

    @Test
    void boardComesBackWhenTheBodyThrows() {
        ScratchBoardPool pool = new ScratchBoardPool(4);
        assertThrows(IllegalStateException.class, () -> {
            try (PooledBoard scratch = pool.rent(FENUtils.getBoardFrom(FEN))) {
                scratch.board().clearAll();
                throw new IllegalStateException("detector crashed");
            }
        });
        assertEquals(1, pool.idleSize());
    }

    @Test
    void idleBoardsAreCapped() {
        ScratchBoardPool pool = new ScratchBoardPool(2);
        Board source = FENUtils.getBoardFrom(FEN);
        List<PooledBoard> rented = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            rented.add(pool.rent(source));
        }
        rented.forEach(PooledBoard::close);
        assertEquals(2, pool.idleSize());
        assertThrows(IllegalArgumentException.class, () -> new ScratchBoardPool(-1));
    }

    @Test
    void concurrentRentAndReturn() throws Exception {
        ScratchBoardPool pool = new ScratchBoardPool(8);
        Board source = FENUtils.getBoardFrom(FEN);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int task = 0; task < 32; task++) {
                results.add(executor.submit(() -> {
                    for (int i = 0; i < 500; i++) {
                        try (PooledBoard scratch = pool.rent(source)) {
                            if (!scratch.board().equals(source)) {
                                return false;
                            }
                            scratch.board().clear(Square.fromName("e1"));
                        }
                    }
                    return true;
                }));
            }
            for (Future<Boolean> result : results) {
                assertTrue(result.get(30, TimeUnit.SECONDS), "Every rental must start from a clean copy");
            }
        } finally {
            executor.shutdownNow();
        }
        assertTrue(pool.idleSize() <= pool.maxSize());
        assertNotNull(source.get(Square.fromName("e1")));
    }
}
