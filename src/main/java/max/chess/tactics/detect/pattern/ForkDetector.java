package max.chess.tactics.detect.pattern;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.detect.Finding;
import max.chess.tactics.detect.FindingCategory;
import max.chess.tactics.detect.TacticContext;
import max.chess.tactics.detect.TacticDetector;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * One piece hitting two or more enemy pieces. When the king is one of them the other piece
 * falls once the king has moved, otherwise at least one target must really be winnable.
 */
public final class ForkDetector implements TacticDetector {

    private record Target(Square square, Piece piece) {}

    @Override
    public String name() {
        return "fork";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Board after = context.after();
        IntArrayList attacked = context.attackedByMovedPiece();
        if (attacked.size() < 2) {
            return Optional.empty();
        }
        List<Target> targets = new ArrayList<>(attacked.size());
        for (int i = 0; i < attacked.size(); i++) {
            Square square = Square.of(attacked.getInt(i));
            targets.add(new Target(square, after.get(square)));
        }
        Piece forker = context.movedPiece();
        boolean hasKing = targets.stream().anyMatch(t -> t.piece().type() == PieceType.KING);

        if (hasKing && forker.type() == PieceType.KNIGHT) {
            Optional<Finding> royal = knightForkWithKing(context, targets);
            if (royal.isPresent()) {
                return royal;
            }
        }

        if (targets.size() >= 3 && hasKing
                && targets.stream().anyMatch(t -> t.piece().type() == PieceType.QUEEN)
                && targets.stream().anyMatch(t -> t.piece().type() == PieceType.ROOK)) {
            return Optional.of(Finding.check("family fork (king, queen, and rook)", 10, FindingCategory.TACTIC));
        }

        List<Target> valuable = targets.stream()
                .filter(t -> t.piece().value() >= context.config().valuableTargetValue)
                .sorted(Comparator.comparingInt((Target t) -> t.piece().value()).reversed())
                .limit(2)
                .toList();
        if (valuable.size() >= 2 && canWinMaterial(context, valuable)) {
            String description = "forks " + valuable.get(0).piece().displayName()
                    + " and " + valuable.get(1).piece().displayName();
            return Optional.of(valuable.get(0).piece().type() == PieceType.KING
                    ? Finding.check(description, 9, FindingCategory.TACTIC)
                    : Finding.of(description, 9, FindingCategory.TACTIC));
        }
        return Optional.empty();
    }

    private static Optional<Finding> knightForkWithKing(TacticContext context, List<Target> targets) {
        Board after = context.after();
        for (Target other : targets) {
            switch (other.piece().type()) {
                case QUEEN -> {
                    return Optional.of(Finding.check("royal fork (king and queen)", 10, FindingCategory.TACTIC));
                }
                case ROOK -> {
                    return Optional.of(Finding.check("forks king and rook", 10, FindingCategory.TACTIC));
                }
                case BISHOP, KNIGHT -> {
                    boolean defended = AttackUtils.countDefenders(after, other.square(), context.enemy()) > 0;
                    if (!defended || AttackUtils.safeSquaresFor(after, other.square(), context.pool()).isEmpty()) {
                        return Optional.of(Finding.check("forks king and " + other.piece().displayName(), 9, FindingCategory.TACTIC));
                    }
                }
                case PAWN, KING -> {
                }
            }
        }
        return Optional.empty();
    }

    private static boolean canWinMaterial(TacticContext context, List<Target> valuable) {
        Board after = context.after();
        int forkerValue = context.movedPiece().value();
        for (Target target : valuable) {
            if (target.piece().type() == PieceType.KING) {
                return true;
            }
            boolean canRecapture = AttackUtils.canAttack(after, target.square(), target.piece(), context.to());
            if (canRecapture) {
                if (target.piece().value() > forkerValue) {
                    for (Target other : valuable) {
                        if (other != target && !AttackUtils.canAttack(after, other.square(), other.piece(), context.to())) {
                            return true;
                        }
                    }
                }
            } else {
                boolean defended = AttackUtils.countDefenders(after, target.square(), context.enemy()) > 0;
                if (!defended || target.piece().value() > forkerValue) {
                    return true;
                }
            }
        }
        return false;
    }
}
