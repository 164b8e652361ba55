package max.chess.tactics.defense;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Direction;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.notation.Move;

/**
 * Local mate checks: is a king mated right now, and can the opponent mate in one.
 * Castling, en passant and under-promotions are not tried.
 */
public final class MateThreats {
    private final ScratchBoardPool pool;

    public MateThreats(ScratchBoardPool pool) {
        this.pool = pool;
    }

    public boolean isCheckmated(Board board, Color color) {
        Square king = board.findKing(color);
        if (king == null || !AttackUtils.isAttackedBy(board, king, color.getOppositeColor())) {
            return false;
        }
        if (!AttackUtils.kingEscapeSquares(board, color, pool).isEmpty()) {
            return false;
        }
        IntArrayList checkers = AttackUtils.attackersOf(board, king, color.getOppositeColor());
        if (checkers.size() >= 2) {
            return true;
        }
        Square checker = Square.of(checkers.getInt(0));
        if (canLegallyReach(board, color, checker)) {
            return false;
        }
        Piece checkingPiece = board.get(checker);
        if (checkingPiece.type().isSliding()) {
            Direction direction = Direction.between(checker, king);
            Square square = checker.step(direction);
            while (square != null && square != king) {
                if (canLegallyReach(board, color, square)) {
                    return false;
                }
                square = square.step(direction);
            }
        }
        return true;
    }

    /** A move of {@code attacker} that mates the other side at once, or null. */
    public Move findMateInOne(Board board, Color attacker) {
        Color defender = attacker.getOppositeColor();
        try (PooledBoard scratch = pool.rent(board)) {
            Board work = scratch.board();
            for (int i = 0; i < 64; i++) {
                Piece piece = board.get(i);
                if (piece == null || piece.color() != attacker) continue;
                Square from = Square.of(i);
                IntArrayList targets = AttackUtils.moveTargets(board, from);
                for (int t = 0; t < targets.size(); t++) {
                    Square to = Square.of(targets.getInt(t));
                    Piece captured = board.get(to);
                    if (captured != null && captured.type() == PieceType.KING) continue;
                    Move move = new Move(from, to, promotionFor(piece, to));
                    work.copyFrom(board);
                    work.applyMove(move);
                    if (AttackUtils.isInCheck(work, attacker)) continue;
                    if (isCheckmated(work, defender)) {
                        return move;
                    }
                }
            }
        }
        return null;
    }

    private static PieceType promotionFor(Piece piece, Square to) {
        if (piece.type() == PieceType.PAWN && to.row == piece.color().promotionRank()) {
            return PieceType.QUEEN;
        }
        return null;
    }

    // A non-king piece of `color` moving to `target` without leaving its king in check
    private boolean canLegallyReach(Board board, Color color, Square target) {
        try (PooledBoard scratch = pool.rent(board)) {
            Board work = scratch.board();
            for (int i = 0; i < 64; i++) {
                Piece piece = board.get(i);
                if (piece == null || piece.color() != color || piece.type() == PieceType.KING) continue;
                Square from = Square.of(i);
                if (!AttackUtils.canMoveTo(board, from, piece, target)) continue;
                work.copyFrom(board);
                work.applyMove(new Move(from, target, promotionFor(piece, target)));
                if (!AttackUtils.isInCheck(work, color)) {
                    return true;
                }
            }
        }
        return false;
    }
}
