package max.chess.tactics.explain;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.common.Piece;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.detect.TacticContext;

import java.util.Optional;

/**
 * Capture wording from the exchange value. An equal trade on a defended square is never
 * called a win, even when the exchange comes out slightly positive.
 */
final class WinningCaptureDescriber {
    private final AnalysisConfig config;

    WinningCaptureDescriber(AnalysisConfig config) {
        this.config = config;
    }

    Optional<String> describe(TacticContext context, int exchangeValue) {
        Piece captured = context.captured();
        if (captured == null) {
            return Optional.empty();
        }
        String name = captured.displayName();
        boolean defended = AttackUtils.isAttackedBy(context.after(), context.to(), context.enemy());

        if (exchangeValue > 0) {
            if (defended && context.piece().value() == captured.value()) {
                return Optional.of("trades " + name);
            }
            String seeInfo = config.showSeeValues ? " (SEE +" + exchangeValue + ")" : "";
            return Optional.of("wins " + name + seeInfo);
        }
        if (exchangeValue == 0) {
            return Optional.of((defended ? "trades " : "captures ") + name);
        }
        return Optional.of("captures " + name + (config.showSeeValues ? " (loses exchange)" : ""));
    }
}
