package max.chess.tactics.explain;

/** Rewrites an explanation for the reader's level. */
public final class ExplanationFormatter {

    private ExplanationFormatter() {
    }

    public static String adjust(String explanation, ComplexityLevel level) {
        if (explanation == null || explanation.isEmpty()) {
            return explanation;
        }
        return switch (level) {
            case BEGINNER -> forBeginner(explanation);
            case INTERMEDIATE -> forIntermediate(explanation);
            case ADVANCED, MASTER -> explanation;
        };
    }

    private static String forBeginner(String explanation) {
        return explanation
                .replace("SEE +", "wins ")
                .replace("SEE -", "loses ")
                .replace("(SEE ", "(")
                .replace("only good move", "best move")
                .replace("x-ray attack", "attack through a piece")
                .replace(" (absolute)", "");
    }

    private static String forIntermediate(String explanation) {
        return explanation.replace(" (absolute)", "");
    }
}
