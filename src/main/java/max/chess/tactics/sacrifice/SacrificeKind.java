package max.chess.tactics.sacrifice;

public enum SacrificeKind {
    NONE,
    FAIR_TRADE,
    WINNING_CAPTURE,
    LOSING_CAPTURE,
    EXCHANGE_SACRIFICE,
    SACRIFICE,
    BRILLIANT
}
