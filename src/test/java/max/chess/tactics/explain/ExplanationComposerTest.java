package max.chess.tactics.explain;

import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Evaluation;
import max.chess.tactics.notation.FENUtils;
import max.chess.tactics.notation.Move;
import max.chess.tactics.sacrifice.SacrificeKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class ExplanationComposerTest {
    private final ExplanationComposer composer = new ExplanationComposer(AnalysisConfig.DEFAULT);

    private MoveExplanation explain(String fen, String move, String evaluation) {
        return composer.explain(fen, move, evaluation, List.of());
    }

    @Test
    void royalFork() {
        MoveExplanation explanation = explain("8/3q4/6k1/8/8/5N2/8/4K3 w - - 0 1", "f3e5", "+4.20");
        assertEquals(List.of("creates threat on queen", "royal fork (king and queen)"), explanation.reasons());
        assertTrue(explanation.errors().isEmpty());
    }

    @Test
    void backRankMate() {
        MoveExplanation explanation = explain("6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1", "a1a8", "Mate in 1");
        assertEquals(List.of("back rank mate threat"), explanation.reasons());
        assertEquals("threatens checkmate", explanation.threats().get(0).description());
    }

    @Test
    void skewer() {
        assertEquals(List.of("skewers king, winning rook"),
                explain("4r3/4k3/8/8/8/8/8/R5K1 w - - 0 1", "a1e1", "+5.00").reasons());
    }

    @Test
    void absolutePinWhileDeveloping() {
        MoveExplanation explanation = explain("4k3/3n4/8/8/8/8/8/4KB2 w - - 0 1", "f1b5", "+0.40");
        assertEquals(List.of("pins knight to king (absolute)", "develops piece"), explanation.reasons());
        assertEquals("pins knight to king, develops piece",
                ExplanationFormatter.adjust(explanation.text(), ComplexityLevel.INTERMEDIATE));
    }

    @Test
    void winningCaptureHidesExchangeValueByDefault() {
        MoveExplanation explanation = explain("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "d1d8", "+3.10");
        assertEquals(List.of("wins bishop"), explanation.reasons());
        assertTrue(explanation.exchangeValue().isEmpty());
        assertEquals(SacrificeKind.WINNING_CAPTURE, explanation.sacrifice().kind());
    }

    @Test
    void winningCaptureWithExchangeValue() {
        ExplanationComposer verbose = new ExplanationComposer(new AnalysisConfig.Builder().showSeeValues(true).build());
        MoveExplanation explanation = verbose.explain("3b4/8/7k/8/8/8/8/3R2K1 w - - 0 1", "d1d8", "+3.10", List.of());
        assertEquals(List.of("wins bishop (SEE +3)"), explanation.reasons());
        assertEquals(3, explanation.exchangeValue().getAsInt());
        assertEquals("wins bishop (wins 3)", ExplanationFormatter.adjust(explanation.text(), ComplexityLevel.BEGINNER));
    }

    @Test
    void enPassantIsDescribedAsACapture() {
        MoveExplanation explanation = explain("4k3/8/8/3pP3/8/8/8/4K3 w - d6 0 1", "e5d6", "+1.20");
        assertTrue(explanation.reasons().contains("wins pawn"), explanation.text());
        assertEquals(SacrificeKind.WINNING_CAPTURE, explanation.sacrifice().kind());
    }

    @Test
    void queenTrade() {
        MoveExplanation explanation = explain("4k3/8/4p3/3q4/8/8/8/3QK3 w - - 0 1", "d1d5", "0.00");
        assertEquals(List.of("trades queen"), explanation.reasons());
        assertEquals(SacrificeKind.FAIR_TRADE, explanation.sacrifice().kind());
    }

    @Test
    void queenSacrificeIsNamedOnce() {
        ExplanationComposer roomy = new ExplanationComposer(new AnalysisConfig.Builder().maxReasons(4).build());
        MoveExplanation explanation = roomy.explain("4k3/8/2p5/3p4/8/8/8/3QK3 w - - 0 1", "d1d5", "+1.50", List.of());
        assertTrue(explanation.reasons().contains("queen sacrifice"), explanation.text());
        assertFalse(explanation.text().contains("captures pawn"), explanation.text());
    }

    @Test
    void moveShapes() {
        assertEquals(List.of("castles kingside for safety"), explain("4k3/8/8/8/8/8/8/4K2R w - - 0 1", "e1g1", "").reasons());
        assertEquals(List.of("promotes to Q"), explain("8/4P3/8/8/8/k7/8/4K3 w - - 0 1", "e7e8q", "").reasons());
        assertEquals(List.of("aggressive pawn push"), explain("4k3/8/8/8/8/8/4P3/4K3 w - - 0 1", "e2e4", "").reasons());
    }

    @Test
    void evaluationFallbacks() {
        String fen = "4k3/8/8/8/8/8/8/4K3 w - - 0 1";
        assertEquals("maintains winning advantage", explain(fen, "e1d1", "+5.00").text());
        assertEquals("maintains balance", explain(fen, "e1d1", "0.10").text());
        assertEquals("improves position", explain(fen, "e1d1", "1.0").text());
        assertEquals(ExplanationComposer.ENGINE_FALLBACK, explain(fen, "e1d1", "").text());
        assertEquals("fights back in difficult position",
                explain("4k3/8/8/8/8/8/8/4K3 b - - 0 1", "e8d8", "+5.00").text());
    }

    @Test
    void unreadableInputFallsBack() {
        MoveExplanation garbage = explain("not a fen", "e2e4", "+1.00");
        assertEquals(List.of(ExplanationComposer.ENGINE_FALLBACK), garbage.reasons());
        assertFalse(garbage.errors().isEmpty());

        MoveExplanation emptySquare = explain("4k3/8/8/8/8/8/8/4K3 w - - 0 1", "a1a2", "+1.00");
        assertEquals(List.of(ExplanationComposer.ENGINE_FALLBACK), emptySquare.reasons());
        assertEquals("composer", emptySquare.errors().get(0).source());
    }

    @Test
    void onlyLegalReplyFromRequest() {
        AnalysisRequest request = AnalysisRequest.builder()
                .board(FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/R3K3 w - - 0 1"))
                .move(Move.fromAlgebraicNotation("a1a8"))
                .evaluation(Evaluation.ofPawns(5.0))
                .onlyLegalReply(true)
                .build();
        MoveExplanation explanation = composer.explain(request);
        assertEquals("only move", explanation.reasons().get(0));
        assertTrue(explanation.reasons().size() <= AnalysisConfig.DEFAULT.maxReasons);
    }

    @Test
    void explainingTwiceGivesTheSameText() {
        String fen = "8/3q4/6k1/8/8/5N2/8/4K3 w - - 0 1";
        assertEquals(explain(fen, "f3e5", "+4.20").text(), explain(fen, "f3e5", "+4.20").text());
    }

    @Test
    void requestNeedsBoardAndMove() {
        assertThrows(IllegalArgumentException.class, () -> AnalysisRequest.builder().build());
    }
}
