package max.chess.tactics.quality;

public enum MoveQuality {
    BRILLIANT("!!", "Brilliant"),
    BEST("", "Best"),
    EXCELLENT("", "Excellent"),
    GOOD("", "Good"),
    BOOK("", "Book"),
    INACCURACY("?!", "Inaccuracy"),
    MISTAKE("?", "Mistake"),
    BLUNDER("??", "Blunder"),
    FORCED("", "Forced");

    public final String symbol;
    public final String label;

    MoveQuality(String symbol, String label) {
        this.symbol = symbol;
        this.label = label;
    }
}
