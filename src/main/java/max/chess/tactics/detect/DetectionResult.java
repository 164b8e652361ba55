package max.chess.tactics.detect;

import java.util.Optional;

/** Outcome of one detector run: a finding, nothing, or a recovered failure. */
public final class DetectionResult {
    private static final DetectionResult NONE = new DetectionResult(null, null);

    public final Finding finding; // nullable
    public final DetectionError error; // nullable

    private DetectionResult(Finding finding, DetectionError error) {
        this.finding = finding;
        this.error = error;
    }

    public static DetectionResult found(Finding finding) { return new DetectionResult(finding, null); }
    public static DetectionResult none() { return NONE; }
    public static DetectionResult error(DetectionError error) { return new DetectionResult(null, error); }

    public static DetectionResult of(Optional<Finding> finding) {
        return finding.map(DetectionResult::found).orElse(NONE);
    }

    public boolean isFound() { return finding != null; }
    public boolean isError() { return error != null; }

    @Override
    public String toString() {
        if (finding != null) return "found(" + finding.description() + ")";
        if (error != null) return "error(" + error + ")";
        return "none";
    }
}
