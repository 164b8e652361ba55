package max.chess.tactics.explain;

import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.defense.Defense;
import max.chess.tactics.defense.DefenseAnalyzer;
import max.chess.tactics.detect.DetectionError;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticalPatternDetector;
import max.chess.tactics.notation.Evaluation;
import max.chess.tactics.sacrifice.SacrificeClassifier;
import max.chess.tactics.sacrifice.SacrificeVerdict;
import max.chess.tactics.threat.Threat;
import max.chess.tactics.threat.ThreatAnalyzer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Turns one engine move into a couple of short reasons. Tactical patterns come first, then
 * material, then simple positional wording, then the evaluation as a last resort.
 * Never throws: whatever goes wrong ends up as "best move by engine".
 */
public final class ExplanationComposer {
    public static final String ENGINE_FALLBACK = "best move by engine";

    private final AnalysisConfig config;
    private final ScratchBoardPool pool;
    private final TacticalPatternDetector tactics;
    private final DefenseAnalyzer defenseAnalyzer;
    private final ThreatAnalyzer threatAnalyzer;
    private final SacrificeClassifier sacrificeClassifier;
    private final WinningCaptureDescriber captureDescriber;

    public ExplanationComposer(AnalysisConfig config) {
        this(config, new ScratchBoardPool(config.poolMaxSize), new TacticalPatternDetector());
    }

    public ExplanationComposer(AnalysisConfig config, ScratchBoardPool pool, TacticalPatternDetector tactics) {
        this.config = config;
        this.pool = pool;
        this.tactics = tactics;
        this.defenseAnalyzer = new DefenseAnalyzer(config, pool);
        this.threatAnalyzer = new ThreatAnalyzer(config, pool);
        this.sacrificeClassifier = new SacrificeClassifier(config, pool);
        this.captureDescriber = new WinningCaptureDescriber(config);
    }

    /** Explains a move given as raw FEN, move code, evaluation text and PV lines. */
    public MoveExplanation explain(String fen, String move, String evaluation, List<String> pvLines) {
        AnalysisRequest request;
        try {
            request = AnalysisRequest.of(fen, move, evaluation, pvLines);
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("Cannot read request " + fen + " / " + move + ": " + e);
            }
            return MoveExplanation.fallback(ENGINE_FALLBACK, DetectionError.of("request", e));
        }
        return explain(request);
    }

    public MoveExplanation explain(AnalysisRequest request) {
        try {
            return compose(request);
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("Explanation failed for " + request.move + ": " + e);
            }
            return MoveExplanation.fallback(ENGINE_FALLBACK, DetectionError.of("composer", e));
        }
    }

    private MoveExplanation compose(AnalysisRequest request) {
        TacticContext context = TacticContext.of(request.board, request.move, request.pvLines,
                request.evaluation, request.secondBestEvaluation, request.onlyLegalReply, config, pool);
        int limit = config.maxReasons;
        List<DetectionError> errors = new ArrayList<>();
        Set<String> reasons = new LinkedHashSet<>(tactics.collect(context, limit, errors).stream()
                .map(f -> f.description())
                .toList());

        int exchangeValue = context.seeOfMove();
        SacrificeVerdict verdict = sacrificeClassifier.classify(context.before(), context.move(), exchangeValue,
                request.previousEvaluation, request.evaluation);
        if (verdict.sacrifice()) {
            add(reasons, verdict.text());
        } else if (context.isCapture()) {
            captureDescriber.describe(context, exchangeValue).ifPresent(text -> add(reasons, text));
        }
        addMoveShapeReasons(context, reasons);

        if (reasons.isEmpty()) {
            reasons.add(evaluationFallback(request.evaluation, context.color()));
        }

        List<Defense> defenses = defenseAnalyzer.analyzeDefenses(context.before(), context.move(), context.color());
        List<Threat> threats = threatAnalyzer.analyzeThreatsAfterMove(context.before(), context.move(), context.color());
        OptionalInt shownExchange = context.isCapture() && config.showSeeValues
                ? OptionalInt.of(exchangeValue) : OptionalInt.empty();

        List<String> capped = reasons.stream().limit(limit).toList();
        return new MoveExplanation(capped, verdict, shownExchange, defenses, threats, errors);
    }

    private void add(Set<String> reasons, String reason) {
        if (reasons.size() < config.maxReasons) {
            reasons.add(reason);
        }
    }

    // Pawn pushes, promotion, centralization, development, castling
    private void addMoveShapeReasons(TacticContext context, Set<String> reasons) {
        Piece piece = context.piece();
        Square from = context.from();
        Square to = context.to();
        if (piece.type() == PieceType.PAWN) {
            if (Math.abs(to.row - from.row) == 2) {
                add(reasons, "aggressive pawn push");
            }
            if (to.row == piece.color().promotionRank()) {
                PieceType promotion = context.move().promotion() == null ? PieceType.QUEEN : context.move().promotion();
                add(reasons, "promotes to " + Character.toUpperCase(promotion.letter));
            }
        }
        boolean minor = piece.type() == PieceType.KNIGHT || piece.type() == PieceType.BISHOP;
        if (minor && to.col >= 2 && to.col <= 5 && to.row >= 2 && to.row <= 5) {
            add(reasons, "centralizes piece");
        }
        if (minor && (from.row == 0 || from.row == 7)) {
            add(reasons, "develops piece");
        }
        if (piece.type() == PieceType.KING && Math.abs(to.col - from.col) == 2) {
            add(reasons, to.col > from.col ? "castles kingside for safety" : "castles queenside");
        }
    }

    private String evaluationFallback(Optional<Evaluation> evaluation, Color mover) {
        if (evaluation.isEmpty()) {
            return ENGINE_FALLBACK;
        }
        double score = evaluation.get().forMover(mover, config.mateScorePawns);
        if (score > config.winningAdvantage) return "maintains winning advantage";
        if (score < -config.winningAdvantage) return "fights back in difficult position";
        if (Math.abs(score) < config.balancedBand) return "maintains balance";
        return "improves position";
    }
}
