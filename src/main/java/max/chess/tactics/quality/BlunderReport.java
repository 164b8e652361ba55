package max.chess.tactics.quality;

/** {@code quality} is null when the drop stays below the inaccuracy threshold. */
public record BlunderReport(MoveQuality quality, double evalDrop, boolean whiteBlundered) {

    public boolean isBlunder() {
        return quality != null;
    }
}
