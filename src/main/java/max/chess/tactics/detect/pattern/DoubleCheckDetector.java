package max.chess.tactics.detect.pattern;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.Optional;

public final class DoubleCheckDetector implements TacticDetector {

    @Override
    public String name() {
        return "double-check";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        if (!AttackUtils.givesCheck(context.after(), context.to())) {
            return Optional.empty();
        }
        if (AttackUtils.checkers(context.after(), context.enemy()).size() >= 2) {
            return Optional.of(Finding.check("double check!", 10, FindingCategory.CHECK));
        }
        return Optional.empty();
    }
}
