package max.chess.tactics.board.pool;

import max.chess.tactics.board.Board;

public final class PooledBoard implements AutoCloseable {
    private final ScratchBoardPool pool;
    private Board board;

    PooledBoard(ScratchBoardPool pool, Board board) {
        this.pool = pool;
        this.board = board;
    }

    public Board board() {
        if (board == null) {
            throw new IllegalStateException("Scratch board used after it was returned to the pool");
        }
        return board;
    }

    @Override
    public void close() {
        if (board != null) {
            Board returned = board;
            board = null;
            pool.giveBack(returned);
        }
    }
}
