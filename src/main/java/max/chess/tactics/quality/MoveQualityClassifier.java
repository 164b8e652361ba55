package max.chess.tactics.quality;

import max.chess.tactics.common.Color;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Evaluation;

/**
 * Labels a played move from the centipawn loss between the evaluation before and after it.
 * Both evaluations are from the mover's point of view. The loss thresholds scale with
 * {@code aggressiveness}: 0 makes them 25% stricter, 100 makes them 25% more lenient.
 */
public final class MoveQualityClassifier {
    public static final double MATE_CP = 10_000;
    private static final double MATE_THRESHOLD_CP = 9_000;
    private static final double MISSED_MATE_LOSS = 9_999;

    private final AnalysisConfig config;

    public MoveQualityClassifier(AnalysisConfig config) {
        this.config = config;
    }

    public MoveQualityResult classify(double evalBeforeCp, double evalAfterCp, boolean bestMove) {
        return classify(evalBeforeCp, evalAfterCp, bestMove, false, false, false, false);
    }

    public MoveQualityResult classify(double evalBeforeCp,
                                      double evalAfterCp,
                                      boolean bestMove,
                                      boolean onlyLegalMove,
                                      boolean bookMove,
                                      boolean sacrifice,
                                      boolean winsSignificantMaterial) {
        double cpLoss = evalBeforeCp - evalAfterCp;

        if (onlyLegalMove) {
            return MoveQualityResult.of(MoveQuality.FORCED, cpLoss);
        }
        if (bookMove && cpLoss < config.bookCp) {
            return MoveQualityResult.of(MoveQuality.BOOK, cpLoss);
        }

        boolean hadMate = evalBeforeCp > MATE_THRESHOLD_CP;
        boolean wasMated = evalBeforeCp < -MATE_THRESHOLD_CP;
        if (hadMate && evalAfterCp <= MATE_THRESHOLD_CP) {
            return new MoveQualityResult(MoveQuality.BLUNDER, "Blunder - missed checkmate", MISSED_MATE_LOSS);
        }
        if (!wasMated && evalAfterCp < -MATE_THRESHOLD_CP) {
            return new MoveQualityResult(MoveQuality.BLUNDER, "Blunder - allows checkmate", MISSED_MATE_LOSS);
        }

        if (bestMove && (sacrifice || winsSignificantMaterial) && cpLoss <= 0) {
            return MoveQualityResult.of(MoveQuality.BRILLIANT, cpLoss);
        }

        double scale = aggressivenessScale();
        if (cpLoss >= config.blunderCp * scale) return MoveQualityResult.of(MoveQuality.BLUNDER, cpLoss);
        if (cpLoss >= config.mistakeCp * scale) return MoveQualityResult.of(MoveQuality.MISTAKE, cpLoss);
        if (cpLoss >= config.inaccuracyCp * scale) return MoveQualityResult.of(MoveQuality.INACCURACY, cpLoss);
        if (bestMove) return MoveQualityResult.of(MoveQuality.BEST, cpLoss);
        if (cpLoss <= config.excellentCp) return MoveQualityResult.of(MoveQuality.EXCELLENT, cpLoss);
        return MoveQualityResult.of(MoveQuality.GOOD, cpLoss);
    }

    /** Same as {@link #classify(double, double, boolean)} with engine evaluations, mates mapped to +/-{@value #MATE_CP}. */
    public MoveQualityResult classify(Evaluation before, Evaluation after, Color mover, boolean bestMove) {
        return classify(toCentipawns(before, mover), toCentipawns(after, mover), bestMove);
    }

    /** Classification from a centipawn loss alone, a non-positive loss counting as the best move. */
    public MoveQualityResult quickClassify(double cpLoss) {
        return classify(cpLoss, 0, cpLoss <= 0);
    }

    double aggressivenessScale() {
        return 1.0 + (config.aggressiveness - 50) / 200.0;
    }

    public static double toCentipawns(Evaluation evaluation, Color mover) {
        return evaluation.forMover(mover, MATE_CP / 100.0) * 100.0;
    }
}
