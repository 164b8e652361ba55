package max.chess.tactics.detect.pattern;

import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;
import max.chess.tactics.notation.PvLine;

import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/** Read off the main line: mostly checks, and a move pair that comes back. */
public final class PerpetualCheckDetector implements TacticDetector {

    @Override
    public String name() {
        return "perpetual-check";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Optional<PvLine> mainLine = context.mainLine();
        if (mainLine.isEmpty() || !isPerpetual(mainLine.get(), context.config())) {
            return Optional.empty();
        }
        return Optional.of(Finding.of("perpetual check", 7, FindingCategory.CHECK));
    }

    static boolean isPerpetual(PvLine line, AnalysisConfig config) {
        int plies = line.size();
        if (plies < config.perpetualMinPlies) {
            return false;
        }
        if (line.checkCount() < plies * config.perpetualCheckRatio) {
            return false;
        }
        Set<String> pairs = new HashSet<>();
        int scan = Math.min(plies, config.perpetualScanPlies);
        for (int i = 0; i + 1 < scan; i += 2) {
            if (!pairs.add(line.moves().get(i) + line.moves().get(i + 1))) {
                return true;
            }
        }
        return false;
    }
}
