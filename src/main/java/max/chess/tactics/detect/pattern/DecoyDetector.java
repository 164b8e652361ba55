package max.chess.tactics.detect.pattern;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.common.Square;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;
import max.chess.tactics.notation.Move;

import java.util.Optional;

/**
 * Offered piece checking a cramped king, confirmed by the main line: the reply has to
 * land on the offered square. Without a line nothing is reported.
 */
public final class DecoyDetector implements TacticDetector {
    private static final int MAX_KING_SQUARES = 2;

    @Override
    public String name() {
        return "decoy";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        if (context.movedPiece().value() < context.config().valuableTargetValue) {
            return Optional.empty();
        }
        Board after = context.after();
        int ourDefenders = AttackUtils.countDefenders(after, context.to(), context.color());
        int theirAttackers = AttackUtils.countAttackers(after, context.to(), context.enemy());
        if (theirAttackers == 0 || (ourDefenders >= 2 && ourDefenders >= theirAttackers)) {
            return Optional.empty();
        }
        Square king = after.findKing(context.enemy());
        if (king == null || !AttackUtils.canAttack(after, context.to(), context.movedPiece(), king)) {
            return Optional.empty();
        }
        if (AttackUtils.kingEscapeSquares(after, context.enemy(), context.pool()).size() > MAX_KING_SQUARES) {
            return Optional.empty();
        }
        Optional<Move> reply = context.mainLine().flatMap(line -> line.moveAt(1));
        if (reply.isPresent() && reply.get().to() == context.to()) {
            return Optional.of(Finding.of("decoy sacrifice", 7, FindingCategory.SACRIFICE));
        }
        return Optional.empty();
    }
}
