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

import java.util.Optional;

// Rook or queen landing on the back rank of a king that cannot step off it
public final class BackRankDetector implements TacticDetector {

    @Override
    public String name() {
        return "back-rank";
    }

    @Override
    public Optional<Finding> detect(TacticContext context) {
        Piece piece = context.movedPiece();
        if (piece.type() != PieceType.ROOK && piece.type() != PieceType.QUEEN) {
            return Optional.empty();
        }
        int enemyBackRank = context.enemy().backRank();
        if (context.to().row != enemyBackRank) {
            return Optional.empty();
        }
        Board after = context.after();
        Square king = after.findKing(context.enemy());
        if (king == null || king.row != enemyBackRank) {
            return Optional.empty();
        }
        IntArrayList escapes = AttackUtils.kingEscapeSquares(after, context.enemy(), context.pool());
        for (int i = 0; i < escapes.size(); i++) {
            if (Square.of(escapes.getInt(i)).row != enemyBackRank) {
                return Optional.empty();
            }
        }
        if (AttackUtils.canAttack(after, context.to(), piece, king)) {
            return Optional.of(Finding.check("back rank mate threat", 9, FindingCategory.MATE_PATTERN));
        }
        return Optional.of(Finding.of("threatens back rank", 6, FindingCategory.MATE_PATTERN));
    }
}
