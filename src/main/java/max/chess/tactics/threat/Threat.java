package max.chess.tactics.threat;

import max.chess.tactics.common.Square;

/** A threat on the board, severity from 1 to 5. */
public record Threat(String description, ThreatType type, int severity, Square square) {

    @Override
    public String toString() {
        return description + " [" + type + ", " + severity + "]";
    }
}
