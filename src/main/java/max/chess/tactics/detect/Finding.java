package max.chess.tactics.detect;

/**
 * One reason a move is good: the text shown to the user, a priority and a category.
 * {@code impliesCheck} marks reasons whose wording already says the move checks the king.
 */
public record Finding(String description, int importance, FindingCategory category, boolean impliesCheck) {
    public Finding {
        if (description == null || description.isBlank()) {
            throw new IllegalArgumentException("Finding needs a description");
        }
    }

    public static Finding of(String description, int importance, FindingCategory category) {
        return new Finding(description, importance, category, false);
    }

    public static Finding check(String description, int importance, FindingCategory category) {
        return new Finding(description, importance, category, true);
    }
}
