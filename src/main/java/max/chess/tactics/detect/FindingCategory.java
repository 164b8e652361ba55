package max.chess.tactics.detect;

public enum FindingCategory {
    FORCED,
    THREAT,
    TACTIC,
    CHECK,
    MATE_PATTERN,
    SACRIFICE
}
