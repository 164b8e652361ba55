package max.chess.tactics.detect;

/** Why an analysis step gave up: the step name and a readable cause. */
public record DetectionError(String source, String message) {
    public static DetectionError of(String source, Throwable cause) {
        String message = cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
        return new DetectionError(source, message);
    }

    @Override
    public String toString() {
        return source + ": " + message;
    }
}
