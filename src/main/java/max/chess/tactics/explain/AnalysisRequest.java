package max.chess.tactics.explain;

import max.chess.tactics.board.Board;
import max.chess.tactics.notation.Evaluation;
import max.chess.tactics.notation.FENUtils;
import max.chess.tactics.notation.Move;
import max.chess.tactics.notation.PvLine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One move to explain, with whatever the engine side knows about it. Only the board and the
 * move are required.
 */
public final class AnalysisRequest {
    public final Board board;
    public final Move move;
    public final Optional<Evaluation> evaluation;          // after the move
    public final Optional<Evaluation> previousEvaluation;  // before the move
    public final Optional<Evaluation> secondBestEvaluation;
    public final List<PvLine> pvLines;
    public final boolean onlyLegalReply;

    private AnalysisRequest(Builder b) {
        if (b.board == null || b.move == null) {
            throw new IllegalArgumentException("An analysis request needs a board and a move");
        }
        board = b.board.copy();
        move = b.move;
        evaluation = Optional.ofNullable(b.evaluation);
        previousEvaluation = Optional.ofNullable(b.previousEvaluation);
        secondBestEvaluation = Optional.ofNullable(b.secondBestEvaluation);
        pvLines = List.copyOf(b.pvLines);
        onlyLegalReply = b.onlyLegalReply;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Request from the raw strings the engine side hands over. A bad FEN or move code throws
     * {@link IllegalArgumentException}, an unreadable evaluation is treated as missing.
     */
    public static AnalysisRequest of(String fen, String move, String evaluation, List<String> pvLines) {
        Builder builder = builder()
                .board(FENUtils.getBoardFrom(fen))
                .move(Move.fromAlgebraicNotation(move))
                .evaluation(Evaluation.parse(evaluation).orElse(null));
        if (pvLines != null) {
            for (String line : pvLines) {
                builder.pvLine(PvLine.parse(line));
            }
        }
        return builder.build();
    }

    public static class Builder {
        private Board board;
        private Move move;
        private Evaluation evaluation;
        private Evaluation previousEvaluation;
        private Evaluation secondBestEvaluation;
        private final List<PvLine> pvLines = new ArrayList<>();
        private boolean onlyLegalReply;

        public Builder board(Board v) { board = v; return this; }
        public Builder move(Move v) { move = v; return this; }
        public Builder evaluation(Evaluation v) { evaluation = v; return this; }
        public Builder previousEvaluation(Evaluation v) { previousEvaluation = v; return this; }
        public Builder secondBestEvaluation(Evaluation v) { secondBestEvaluation = v; return this; }
        public Builder pvLine(PvLine v) { pvLines.add(v); return this; }
        public Builder pvLines(List<PvLine> v) { pvLines.clear(); pvLines.addAll(v); return this; }
        public Builder onlyLegalReply(boolean v) { onlyLegalReply = v; return this; }

        public AnalysisRequest build() { return new AnalysisRequest(this); }
    }
}
