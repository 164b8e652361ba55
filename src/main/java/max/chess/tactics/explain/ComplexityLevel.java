package max.chess.tactics.explain;

public enum ComplexityLevel {
    BEGINNER, INTERMEDIATE, ADVANCED, MASTER
}
