package max.chess.tactics.detect;

import java.util.Optional;

/**
 * One tactical pattern. {@link #detect} may throw on an inconsistent board,
 * {@link #run} is the boundary that never does.
 */
public interface TacticDetector {

    String name();

    Optional<Finding> detect(TacticContext context);

    default DetectionResult run(TacticContext context) {
        try {
            return DetectionResult.of(detect(context));
        } catch (RuntimeException e) {
            if (context.config().debug) {
                System.err.println("Detector " + name() + " failed on " + context.move() + ": " + e);
            }
            return DetectionResult.error(DetectionError.of(name(), e));
        }
    }
}
