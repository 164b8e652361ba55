package max.chess.tactics.notation;

import max.chess.tactics.common.Color;

import java.util.Locale;
import java.util.Optional;

/**
 * Engine evaluation as handed over by the UCI side: a White-relative pawn score ("+1.50")
 * or a mate announcement ("Mate in 3", "Mate in -2") relative to the side that moved.
 */
public record Evaluation(double pawns, int mateIn, boolean mate) {
    private static final String MATE_PREFIX = "Mate in ";

    public static Evaluation ofPawns(double pawns) {
        return new Evaluation(pawns, 0, false);
    }

    public static Evaluation ofMate(int mateIn) {
        return new Evaluation(0.0, mateIn, true);
    }

    public static Optional<Evaluation> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty()) {
            return Optional.empty();
        }
        try {
            if (trimmed.startsWith(MATE_PREFIX)) {
                String mateText = trimmed.substring(MATE_PREFIX.length()).trim();
                if (mateText.startsWith("+")) {
                    mateText = mateText.substring(1);
                }
                return Optional.of(ofMate(Integer.parseInt(mateText)));
            }
            String number = trimmed.startsWith("+") ? trimmed.substring(1) : trimmed;
            double pawns = Double.parseDouble(number);
            if (Double.isNaN(pawns) || Double.isInfinite(pawns)) {
                return Optional.empty();
            }
            return Optional.of(ofPawns(pawns));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Score in pawns from the point of view of {@code mover}. A mate counts as
     * {@code mateScore} pawns, positive when the mover is the one mating.
     */
    public double forMover(Color mover, double mateScore) {
        if (mate) {
            if (mateIn > 0) return mateScore;
            if (mateIn < 0) return -mateScore;
            return mateScore;
        }
        return mover == Color.WHITE ? pawns : -pawns;
    }

    /** White-relative pawns, mate scores mapped through the mover. */
    public double forWhite(Color mover, double mateScore) {
        double moverScore = forMover(mover, mateScore);
        return mover == Color.WHITE ? moverScore : -moverScore;
    }

    public boolean isMateForMover() {
        return mate && mateIn > 0;
    }

    public boolean isMateAgainstMover() {
        return mate && mateIn < 0;
    }

    @Override
    public String toString() {
        if (mate) {
            return MATE_PREFIX + mateIn;
        }
        return String.format(Locale.ROOT, "%+.2f", pawns);
    }
}
