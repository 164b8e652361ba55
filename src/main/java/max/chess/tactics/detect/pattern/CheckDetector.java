package max.chess.tactics.detect.pattern;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.Optional;

public final class CheckDetector implements TacticDetector {

    @Override
    public String name() {
        return "check";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        if (!AttackUtils.givesCheck(context.after(), context.to())) {
            return Optional.empty();
        }
        // the king itself is part of the attacked list
        if (context.attackedByMovedPiece().size() >= 2) {
            return Optional.of(Finding.of("check with attack", 4, FindingCategory.CHECK));
        }
        return Optional.of(Finding.of("gives check", 3, FindingCategory.CHECK));
    }
}
