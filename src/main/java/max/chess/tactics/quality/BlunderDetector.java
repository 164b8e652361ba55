package max.chess.tactics.quality;

import max.chess.tactics.config.AnalysisConfig;

/**
 * Compares two consecutive White-relative evaluations and grades the drop suffered by the
 * side that just moved.
 */
public final class BlunderDetector {
    private final AnalysisConfig config;

    public BlunderDetector(AnalysisConfig config) {
        this.config = config;
    }

    public BlunderReport detect(Double currentEval, Double previousEval, boolean whiteMovedLast) {
        if (currentEval == null || previousEval == null) {
            return new BlunderReport(null, 0, false);
        }
        double change = currentEval - previousEval;
        double drop = 0;
        if (whiteMovedLast && change < 0) {
            drop = -change;
        } else if (!whiteMovedLast && change > 0) {
            drop = change;
        }
        boolean whiteBlundered = whiteMovedLast && drop > 0;

        MoveQuality quality = null;
        if (drop >= config.blunderDrop) {
            quality = MoveQuality.BLUNDER;
        } else if (drop >= config.mistakeDrop) {
            quality = MoveQuality.MISTAKE;
        } else if (drop >= config.inaccuracyDrop) {
            quality = MoveQuality.INACCURACY;
        }
        return new BlunderReport(quality, drop, whiteBlundered);
    }
}
