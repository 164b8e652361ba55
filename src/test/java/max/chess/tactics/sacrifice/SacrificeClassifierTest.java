package max.chess.tactics.sacrifice;

import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Evaluation;
import max.chess.tactics.notation.FENUtils;
import max.chess.tactics.notation.Move;
import max.chess.tactics.see.StaticExchangeEvaluator;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class SacrificeClassifierTest {
    private final ScratchBoardPool pool = new ScratchBoardPool(4);
    private final StaticExchangeEvaluator see = new StaticExchangeEvaluator(pool, AnalysisConfig.DEFAULT);
    private final SacrificeClassifier classifier = new SacrificeClassifier(AnalysisConfig.DEFAULT, pool);

    private SacrificeVerdict classify(String fen, String moveCode, Optional<Evaluation> before, Optional<Evaluation> after) {
        Board board = FENUtils.getBoardFrom(fen);
        Move move = Move.fromAlgebraicNotation(moveCode);
        int exchange = see.evaluateCapture(board, move.from(), move.to());
        return classifier.classify(board, move, exchange, before, after);
    }

    private static Optional<Evaluation> pawns(double value) {
        return Optional.of(Evaluation.ofPawns(value));
    }

    @Test
    void rookForKnightWithEngineApproval() {
        SacrificeVerdict verdict = classify("4k3/8/2p5/3n4/8/8/8/3RK3 w - - 0 1", "d1d5", Optional.empty(), pawns(0.2));
        assertEquals(SacrificeKind.EXCHANGE_SACRIFICE, verdict.kind());
        assertTrue(verdict.sacrifice());
        assertEquals(Optional.of("exchange sacrifice (rook for minor piece)"), verdict.description());
    }

    @Test
    void rookForKnightTheEngineDislikes() {
        SacrificeVerdict verdict = classify("4k3/8/2p5/3n4/8/8/8/3RK3 w - - 0 1", "d1d5", Optional.empty(), pawns(-1.0));
        assertEquals(SacrificeKind.LOSING_CAPTURE, verdict.kind());
        assertFalse(verdict.sacrifice());
        assertTrue(verdict.description().isEmpty());
    }

    @Test
    void queenForPawnStillWinning() {
        SacrificeVerdict verdict = classify("4k3/8/2p5/3p4/8/8/8/3QK3 w - - 0 1", "d1d5", Optional.empty(), pawns(1.5));
        assertEquals(SacrificeKind.SACRIFICE, verdict.kind());
        assertEquals(Optional.of("queen sacrifice"), verdict.description());
    }

    @Test
    void blackSacrificeReadFromBlacksSide() {
        // -1.5 is good for black
        SacrificeVerdict verdict = classify("3qk3/8/8/3P4/2P5/8/8/4K3 b - - 0 1", "d8d5", Optional.empty(), pawns(-1.5));
        assertEquals(SacrificeKind.SACRIFICE, verdict.kind());
    }

    @Test
    void undefendedBishopIsAWinningCapture() {
        assertEquals(SacrificeKind.WINNING_CAPTURE,
                classify("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "d1d8", Optional.empty(), Optional.empty()).kind());
    }

    @Test
    void queenTradeIsFair() {
        assertEquals(SacrificeKind.FAIR_TRADE,
                classify("4k3/8/4p3/3q4/8/8/8/3QK3 w - - 0 1", "d1d5", Optional.empty(), pawns(0.0)).kind());
    }

    @Test
    void knightOfferedToARookIsBrilliant() {
        SacrificeVerdict verdict = classify("2r1k3/8/8/8/8/8/8/1N2K3 w - - 0 1", "b1c3", pawns(0.3), pawns(0.4));
        assertEquals(SacrificeKind.BRILLIANT, verdict.kind());
        assertTrue(verdict.brilliant());
        assertEquals(Optional.of("brilliant knight sacrifice"), verdict.description());
    }

    @Test
    void noBrillianceWhenAlreadyWinning() {
        SacrificeVerdict verdict = classify("2r1k3/8/8/8/8/8/8/1N2K3 w - - 0 1", "b1c3", pawns(2.5), pawns(0.4));
        assertEquals(SacrificeKind.NONE, verdict.kind());
        assertFalse(verdict.brilliant());
    }

    @Test
    void quietQueenOfferOnADefendedSquare() {
        // the king recaptures, so black only nets rook for queen
        SacrificeVerdict verdict = classify("4k3/3r4/8/8/8/8/8/2Q1K3 w - - 0 1", "c1d2", Optional.empty(), pawns(1.0));
        assertEquals(SacrificeKind.SACRIFICE, verdict.kind());
        assertEquals(Optional.of("queen sacrifice"), verdict.description());
    }

    @Test
    void kingMovesAreNeverSacrifices() {
        assertSame(SacrificeVerdict.NONE,
                classify("4k3/8/8/8/8/8/8/4K3 w - - 0 1", "e1e2", Optional.empty(), pawns(3.0)));
    }
}
