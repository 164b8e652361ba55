package max.chess.tactics.detect.pattern;

import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;
import max.chess.tactics.notation.FENUtils;
import max.chess.tactics.notation.Move;
import max.chess.tactics.notation.PvLine;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

final class PatternDetectorsTest {
    private final ScratchBoardPool pool = new ScratchBoardPool(4);

    private Optional<String> detect(TacticDetector detector, String fen, String move) {
        TacticContext context = TacticContext.of(FENUtils.getBoardFrom(fen), Move.fromAlgebraicNotation(move),
                AnalysisConfig.DEFAULT, pool);
        return detector.detect(context).map(Finding::description);
    }

    private Optional<String> detectAlong(TacticDetector detector, AnalysisConfig config, String fen, String move, String line) {
        TacticContext context = TacticContext.of(FENUtils.getBoardFrom(fen), Move.fromAlgebraicNotation(move),
                List.of(PvLine.parse(line)), Optional.empty(), Optional.empty(), false, config, pool);
        return detector.detect(context).map(Finding::description);
    }

    @Test
    void bishopPinsKnightToKing() {
        assertEquals(Optional.of("pins knight to king (absolute)"),
                detect(new PinDetector(), "4k3/3n4/8/8/8/8/8/4KB2 w - - 0 1", "f1b5"));
    }

    @Test
    void knightCannotPin() {
        assertTrue(detect(new PinDetector(), "4k3/3n4/8/8/8/8/8/4KN2 w - - 0 1", "f1g3").isEmpty());
    }

    @Test
    void royalForkEvenWhenQueenIsDefended() {
        assertEquals(Optional.of("royal fork (king and queen)"),
                detect(new ForkDetector(), "3r4/3q4/6k1/8/8/5N2/8/4K3 w - - 0 1", "f3e5"));
    }

    @Test
    void singleTargetIsNoFork() {
        assertTrue(detect(new ForkDetector(), "8/8/6k1/8/8/5N2/8/4K3 w - - 0 1", "f3e5").isEmpty());
    }

    @Test
    void knightMatesTheWalledInKing() {
        assertEquals(Optional.of("smothered mate"),
                detect(new SmotheredMateDetector(), "6rk/6pp/8/6N1/8/8/8/6K1 w - - 0 1", "g5f7"));
    }

    @Test
    void noSmotheredMateWhenTheKingCanStepOut() {
        assertTrue(detect(new SmotheredMateDetector(), "7k/6pp/8/6N1/8/8/8/6K1 w - - 0 1", "g5f7").isEmpty());
    }

    @Test
    void knightAndRookCheckTogether() {
        assertEquals(Optional.of("double check!"),
                detect(new DoubleCheckDetector(), "4k3/8/8/8/4N3/8/8/4R1K1 w - - 0 1", "e4f6"));
    }

    @Test
    void singleCheckIsNotDouble() {
        assertTrue(detect(new DoubleCheckDetector(), "4k3/8/8/8/4N3/8/8/6K1 w - - 0 1", "e4f6").isEmpty());
        assertEquals(Optional.of("gives check"),
                detect(new CheckDetector(), "4k3/8/8/8/4N3/8/8/6K1 w - - 0 1", "e4f6"));
    }

    @Test
    void rookOnTheBackRank() {
        assertEquals(Optional.of("back rank mate threat"),
                detect(new BackRankDetector(), "6k1/5ppp/8/8/8/8/8/R5K1 w - - 0 1", "a1a8"));
    }

    @Test
    void kingInFrontOfRook() {
        assertEquals(Optional.of("skewers king, winning rook"),
                detect(new SkewerDetector(), "4r3/4k3/8/8/8/8/8/R5K1 w - - 0 1", "a1e1"));
    }

    @Test
    void onlyLegalReplyIsForced() {
        TacticContext context = TacticContext.of(FENUtils.getBoardFrom("4k3/8/8/8/8/8/8/R3K3 w - - 0 1"),
                Move.fromAlgebraicNotation("a1a8"), List.of(), Optional.empty(), Optional.empty(), true,
                AnalysisConfig.DEFAULT, pool);
        assertEquals(Optional.of("only move"), new SingularMoveDetector().detect(context).map(Finding::description));
    }

    @Test
    void knightHopThreatensRook() {
        assertEquals(Optional.of("creates threat on rook"),
                detect(new ThreatCreationDetector(), "4k3/8/8/3r4/8/8/4N3/4K3 w - - 0 1", "e2c3"));
    }

    @Test
    void equalPieceIsNoNewThreat() {
        assertTrue(detect(new ThreatCreationDetector(), "4k3/8/8/3n4/8/8/4N3/4K3 w - - 0 1", "e2c3").isEmpty());
    }

    @Test
    void knightUncoversRookCheck() {
        assertEquals(Optional.of("discovered check"),
                detect(new DiscoveredAttackDetector(), "4k3/8/8/8/4N3/8/8/4R1K1 w - - 0 1", "e4c3"));
        assertEquals(Optional.of("discovered attack on queen"),
                detect(new DiscoveredAttackDetector(), "4k3/4q3/8/8/4N3/8/8/4R1K1 w - - 0 1", "e4c3"));
    }

    @Test
    void uncoveredMinorPieceIsNotADiscoveredAttack() {
        assertTrue(detect(new DiscoveredAttackDetector(), "4k3/4b3/8/8/4N3/8/8/4R1K1 w - - 0 1", "e4c3").isEmpty());
    }

    @Test
    void takingTheOnlyGuardOfTheRook() {
        assertEquals(Optional.of("removes defender of rook"),
                detect(new RemovalOfDefenderDetector(), "4k3/1n6/8/r7/4B3/8/8/R3K3 w - - 0 1", "e4b7"));
    }

    @Test
    void secondGuardKeepsTheRookSafe() {
        assertTrue(detect(new RemovalOfDefenderDetector(), "4k3/1n6/8/r6r/4B3/8/8/R3K3 w - - 0 1", "e4b7").isEmpty());
    }

    @Test
    void rookGuardsBishopAndKnightAlone() {
        assertEquals(Optional.of("overloads defender of bishop and knight"),
                detect(new OverloadingDetector(), "b2r3k/8/8/8/3n4/5N2/8/1R4K1 w - - 0 1", "b1a1"));
    }

    @Test
    void oneDutyIsNotOverloaded() {
        assertTrue(detect(new OverloadingDetector(), "b2r3k/8/8/8/3n4/8/8/1R4K1 w - - 0 1", "b1a1").isEmpty());
    }

    @Test
    void knightIsTheLastGuardOfTheKingsSquare() {
        assertEquals(Optional.of("deflects key defender"),
                detect(new DeflectionDetector(), "6k1/5pp1/5n2/8/8/3B3Q/8/6K1 w - - 0 1", "d3e4"));
    }

    @Test
    void rookStillGuardsTheKingsSquare() {
        assertTrue(detect(new DeflectionDetector(), "6kr/5pp1/5n2/8/8/3B3Q/8/6K1 w - - 0 1", "d3e4").isEmpty());
    }

    @Test
    void pawnShutsTheBishopIn() {
        assertEquals(Optional.of("traps bishop"),
                detect(new TrappedPieceDetector(), "4k3/8/8/8/8/8/bPP5/R3K3 w - - 0 1", "b2b3"));
    }

    @Test
    void bishopEscapesByTakingThePawn() {
        assertTrue(detect(new TrappedPieceDetector(), "4k3/8/8/8/8/8/bP6/R3K3 w - - 0 1", "b2b3").isEmpty());
    }

    @Test
    void cornerKnightHasNowhereToGo() {
        assertEquals(Optional.of("wins undefended knight"),
                detect(new HangingPieceDetector(), "k6n/8/4P3/5P2/8/8/8/K2R4 w - - 0 1", "d1h1"));
    }

    @Test
    void knightWithAnExitIsNotHanging() {
        assertTrue(detect(new HangingPieceDetector(), "k6n/8/4P3/8/8/8/8/K2R4 w - - 0 1", "d1h1").isEmpty());
    }

    @Test
    void pawnOneStepFromQueening() {
        assertEquals(Optional.of("threatens promotion"),
                detect(new PromotionThreatDetector(), "4k3/8/P7/8/8/8/8/4K3 w - - 0 1", "a6a7"));
        assertEquals(Optional.of("advances passed pawn"),
                detect(new PromotionThreatDetector(), "4k3/8/8/P7/8/8/8/4K3 w - - 0 1", "a5a6"));
    }

    @Test
    void pawnWithAnEnemyPawnAheadIsNotPassed() {
        assertTrue(detect(new PromotionThreatDetector(), "4k3/1p6/8/P7/8/8/8/4K3 w - - 0 1", "a5a6").isEmpty());
    }

    @Test
    void rookSeesThroughItsOwnPawn() {
        assertEquals(Optional.of("x-ray attack"),
                detect(new XRayDetector(), "7k/3b4/8/8/8/3P4/8/R5K1 w - - 0 1", "a1d1"));
    }

    @Test
    void defendedCheaperPieceBehindIsNoXRay() {
        assertTrue(detect(new XRayDetector(), "4k3/3b4/8/8/8/3P4/8/R5K1 w - - 0 1", "a1d1").isEmpty());
    }

    @Test
    void rookOfferedOnTheBackRank() {
        assertEquals(Optional.of("decoy sacrifice"),
                detectAlong(new DecoyDetector(), AnalysisConfig.DEFAULT,
                        "2r3k1/5ppp/8/8/8/8/8/3R2K1 w - - 0 1", "d1d8", "d1d8+ c8d8"));
    }

    @Test
    void noDecoyWithoutTheRecapture() {
        assertTrue(detect(new DecoyDetector(), "2r3k1/5ppp/8/8/8/8/8/3R2K1 w - - 0 1", "d1d8").isEmpty());
    }

    @Test
    void queenHitsTwoLoosePieces() {
        assertEquals(Optional.of("double attack on multiple pieces"),
                detect(new DoubleAttackDetector(), "7k/1n2b3/8/8/8/8/8/4Q1K1 w - - 0 1", "e1e4"));
        assertEquals(Optional.of("double attack: check and wins material"),
                detect(new DoubleAttackDetector(), "8/3q4/6k1/8/8/5N2/8/4K3 w - - 0 1", "f3e5"));
    }

    @Test
    void defendedCheaperTargetsAreNoDoubleAttack() {
        assertTrue(detect(new DoubleAttackDetector(), "1r2k3/1n2b3/8/8/8/8/8/4Q1K1 w - - 0 1", "e1e4").isEmpty());
    }

    @Test
    void queenChecksBackAndForth() {
        AnalysisConfig lenient = new AnalysisConfig.Builder().perpetualCheckRatio(0.5).build();
        String line = "h5e8+ g8h7 e8h5+ h7g8 h5e8+ g8h7 e8h5+ h7g8";
        assertEquals(Optional.of("perpetual check"),
                detectAlong(new PerpetualCheckDetector(), lenient, "6k1/6p1/8/7Q/8/8/8/6K1 w - - 0 1", "h5e8", line));
        // half the plies are checks, below the default ratio
        assertTrue(detectAlong(new PerpetualCheckDetector(), AnalysisConfig.DEFAULT,
                "6k1/6p1/8/7Q/8/8/8/6K1 w - - 0 1", "h5e8", line).isEmpty());
    }

    @Test
    void checksWithoutRepetitionAreNotPerpetual() {
        String line = "h5e8+ g8h7+ e8e4+ h7h8+ e4e8+ h8h7+ e8e7 g7g6";
        assertTrue(detectAlong(new PerpetualCheckDetector(), AnalysisConfig.DEFAULT,
                "6k1/6p1/8/7Q/8/8/8/6K1 w - - 0 1", "h5e8", line).isEmpty());
    }
}
