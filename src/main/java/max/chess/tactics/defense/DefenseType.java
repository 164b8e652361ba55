package max.chess.tactics.defense;

public enum DefenseType {
    PROTECT_PIECE,
    PROTECT_PAWN,
    BLOCK_ATTACK,
    ESCAPE,
    PROTECT_KING,
    PREVENT_MATE
}
