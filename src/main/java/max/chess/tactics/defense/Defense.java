package max.chess.tactics.defense;

import max.chess.tactics.common.Square;

/** Something the move protects. Importance runs from 1 to 5. */
public record Defense(String description, DefenseType type, int importance, Square square) {

    @Override
    public String toString() {
        return description + " [" + type + ", " + importance + "]";
    }
}
