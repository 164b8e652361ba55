package max.chess.tactics.detect;

import max.chess.tactics.detect.pattern.BackRankDetector;
import max.chess.tactics.detect.pattern.CheckDetector;
import max.chess.tactics.detect.pattern.DecoyDetector;
import max.chess.tactics.detect.pattern.DeflectionDetector;
import max.chess.tactics.detect.pattern.DiscoveredAttackDetector;
import max.chess.tactics.detect.pattern.DoubleAttackDetector;
import max.chess.tactics.detect.pattern.DoubleCheckDetector;
import max.chess.tactics.detect.pattern.ForkDetector;
import max.chess.tactics.detect.pattern.HangingPieceDetector;
import max.chess.tactics.detect.pattern.OverloadingDetector;
import max.chess.tactics.detect.pattern.PerpetualCheckDetector;
import max.chess.tactics.detect.pattern.PinDetector;
import max.chess.tactics.detect.pattern.PromotionThreatDetector;
import max.chess.tactics.detect.pattern.RemovalOfDefenderDetector;
import max.chess.tactics.detect.pattern.SingularMoveDetector;
import max.chess.tactics.detect.pattern.SkewerDetector;
import max.chess.tactics.detect.pattern.SmotheredMateDetector;
import max.chess.tactics.detect.pattern.ThreatCreationDetector;
import max.chess.tactics.detect.pattern.TrappedPieceDetector;
import max.chess.tactics.detect.pattern.XRayDetector;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The detector battery. Order matters: earlier, more specific patterns win over later,
 * more generic ones, and collection stops as soon as enough reasons are found.
 */
public final class TacticalPatternDetector {

    private final List<TacticDetector> detectors;

    public TacticalPatternDetector() {
        this(defaultDetectors());
    }

    public TacticalPatternDetector(List<TacticDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public static List<TacticDetector> defaultDetectors() {
        return List.of(
                new SingularMoveDetector(),
                new ThreatCreationDetector(),
                new DoubleCheckDetector(),
                new DiscoveredAttackDetector(),
                new PinDetector(),
                new SkewerDetector(),
                new ForkDetector(),
                new RemovalOfDefenderDetector(),
                new OverloadingDetector(),
                new DeflectionDetector(),
                new TrappedPieceDetector(),
                new HangingPieceDetector(),
                new BackRankDetector(),
                new PromotionThreatDetector(),
                new SmotheredMateDetector(),
                new XRayDetector(),
                new DecoyDetector(),
                new DoubleAttackDetector(),
                new PerpetualCheckDetector(),
                new CheckDetector()
        );
    }

    public List<TacticDetector> detectors() {
        return detectors;
    }

    /** First finding in priority order. */
    public Optional<Finding> detect(TacticContext context) {
        List<Finding> findings = collect(context, 1);
        return findings.isEmpty() ? Optional.empty() : Optional.of(findings.get(0));
    }

    /** Up to {@code limit} findings with distinct descriptions, in priority order. */
    public List<Finding> collect(TacticContext context, int limit) {
        return collect(context, limit, new ArrayList<>());
    }

    /** Same as {@link #collect(TacticContext, int)}, failed detectors are reported into {@code errors}. */
    public List<Finding> collect(TacticContext context, int limit, List<DetectionError> errors) {
        List<Finding> findings = new ArrayList<>(limit);
        Set<String> seen = new LinkedHashSet<>();
        boolean checkTold = false;
        for (TacticDetector detector : detectors) {
            if (findings.size() >= limit) break;
            // a plain check adds nothing once an earlier reason already names the check
            if (checkTold && detector instanceof CheckDetector) continue;
            DetectionResult result = detector.run(context);
            if (result.isError()) {
                errors.add(result.error);
            } else if (result.isFound() && seen.add(result.finding.description())) {
                findings.add(result.finding);
                checkTold |= result.finding.impliesCheck();
            }
        }
        return findings;
    }

    /** Every detector's outcome, errors included, in battery order. */
    public List<DetectionResult> runAll(TacticContext context) {
        List<DetectionResult> results = new ArrayList<>(detectors.size());
        for (TacticDetector detector : detectors) {
            results.add(detector.run(context));
        }
        return results;
    }
}
