package max.chess.tactics.detect;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.Square;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Evaluation;
import max.chess.tactics.notation.Move;
import max.chess.tactics.notation.PvLine;
import max.chess.tactics.see.StaticExchangeEvaluator;

import java.util.List;
import java.util.Optional;

/**
 * Everything a detector may look at for one analysed move. {@code before} and {@code after}
 * are private copies, detectors must not modify them.
 */
public record TacticContext(Board before,
                            Board after,
                            Move move,
                            Piece piece,
                            Color color,
                            Piece captured,
                            List<PvLine> pvLines,
                            Optional<Evaluation> evaluation,
                            Optional<Evaluation> secondBestEvaluation,
                            boolean onlyLegalReply,
                            AnalysisConfig config,
                            StaticExchangeEvaluator see,
                            ScratchBoardPool pool) {

    public static TacticContext of(Board board, Move move, AnalysisConfig config, ScratchBoardPool pool) {
        return of(board, move, List.of(), Optional.empty(), Optional.empty(), false, config, pool);
    }

    public static TacticContext of(Board board,
                                   Move move,
                                   List<PvLine> pvLines,
                                   Optional<Evaluation> evaluation,
                                   Optional<Evaluation> secondBestEvaluation,
                                   boolean onlyLegalReply,
                                   AnalysisConfig config,
                                   ScratchBoardPool pool) {
        Piece piece = board.get(move.from());
        if (piece == null) {
            throw new IllegalArgumentException("No piece to move on " + move.from());
        }
        Piece captured = board.capturedBy(move);
        if (captured != null && captured.color() == piece.color()) {
            throw new IllegalArgumentException("Move " + move + " captures its own " + captured.displayName());
        }
        Board before = board.copy();
        Board after = before.afterMove(move);
        return new TacticContext(before, after, move, piece, piece.color(), captured,
                List.copyOf(pvLines), evaluation, secondBestEvaluation, onlyLegalReply,
                config, new StaticExchangeEvaluator(pool, config), pool);
    }

    public Color enemy() {
        return color.getOppositeColor();
    }

    public Square from() {
        return move.from();
    }

    public Square to() {
        return move.to();
    }

    /** The piece standing on the destination after the move, the promoted piece for promotions. */
    public Piece movedPiece() {
        return after.get(move.to());
    }

    public boolean isCapture() {
        return captured != null;
    }

    /** Where the captured piece stood: the destination, or the passed pawn's square for en passant. */
    public Square capturedSquare() {
        if (captured == null) {
            return null;
        }
        Square passed = before.enPassantSquare(move);
        return passed == null ? move.to() : passed;
    }

    /**
     * Exchange value of the move itself, 0 for quiet moves. A capturing promotion stands on the
     * square as the promoted piece and is credited with what the promotion gains.
     */
    public int seeOfMove() {
        if (captured == null) {
            return 0;
        }
        Square passed = before.enPassantSquare(move);
        if (passed == null) {
            Piece standing = movedPiece();
            return see.evaluateExchange(before, move.to(), standing, color, move.from())
                    + standing.value() - piece.value();
        }
        try (PooledBoard scratch = pool.rent(before)) {
            Board board = scratch.board();
            board.clear(passed);
            board.set(move.to(), captured);
            return see.evaluateExchange(board, move.to(), piece, color, move.from());
        }
    }

    /** Enemy pieces attacked by the moved piece on its new square. */
    public IntArrayList attackedByMovedPiece() {
        return AttackUtils.attackedPieces(after, move.to(), enemy());
    }

    public Optional<PvLine> mainLine() {
        return pvLines.isEmpty() ? Optional.empty() : Optional.of(pvLines.get(0));
    }
}
