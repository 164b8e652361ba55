package max.chess.tactics.threat;

public enum ThreatType {
    HANGING_PIECE,
    MATERIAL_WIN,
    FORK,
    PIN,
    CHECKMATE_THREAT,
    CHECK,
    PROMOTION,
    TRAPPED_PIECE
}
