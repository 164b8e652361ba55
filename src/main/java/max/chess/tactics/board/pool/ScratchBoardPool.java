package max.chess.tactics.board.pool;

import max.chess.tactics.board.Board;

import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Reusable scratch boards for the temporary positions detectors build.
 * Rent with try-with-resources so the board comes back on every exit path:
 * <pre>
 * try (PooledBoard scratch = pool.rent(board)) {
 *     scratch.board().applyMove(move);
 * }
 * </pre>
 * Safe for concurrent rent and return. At most {@code maxSize} idle boards are kept.
 */
public final class ScratchBoardPool {
    private final ConcurrentLinkedQueue<Board> idle = new ConcurrentLinkedQueue<>();
    private final AtomicInteger idleCount = new AtomicInteger();
    private final int maxSize;

    public ScratchBoardPool(int maxSize) {
        if (maxSize < 0) {
            throw new IllegalArgumentException("maxSize must be >= 0 but was " + maxSize);
        }
        this.maxSize = maxSize;
    }

    /** A scratch board holding a copy of {@code source}. */
    public PooledBoard rent(Board source) {
        Board board = idle.poll();
        if (board == null) {
            board = new Board();
        } else {
            idleCount.decrementAndGet();
        }
        board.copyFrom(source);
        return new PooledBoard(this, board);
    }

    void giveBack(Board board) {
        board.clearAll();
        if (idleCount.incrementAndGet() <= maxSize) {
            idle.offer(board);
        } else {
            idleCount.decrementAndGet();
        }
    }

    public int idleSize() {
        return idleCount.get();
    }

    public int maxSize() {
        return maxSize;
    }
}
