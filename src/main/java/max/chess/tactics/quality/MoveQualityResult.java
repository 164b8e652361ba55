package max.chess.tactics.quality;

public record MoveQualityResult(MoveQuality quality, String description, double centipawnLoss) {

    static MoveQualityResult of(MoveQuality quality, double centipawnLoss) {
        return new MoveQualityResult(quality, quality.label, centipawnLoss);
    }

    public String symbol() {
        return quality.symbol;
    }
}
