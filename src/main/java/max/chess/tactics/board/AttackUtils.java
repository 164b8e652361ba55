package max.chess.tactics.board;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Direction;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;

/**
 * Attack and movement primitives every detector is composed from.
 * All static and pure: the board passed in is never modified, temporary positions are rented
 * from the caller's {@link ScratchBoardPool}.
 * Ray walking lives in {@link #walk} and nowhere else.
 */
public final class AttackUtils {
    public static final long[] KNIGHT_ATTACKS_BB = new long[64];
    public static final long[] KING_ATTACKS_BB = new long[64];

    private static final int[][] KNIGHT_OFFSETS = {
            {-2, -1}, {-2, 1}, {-1, -2}, {-1, 2}, {1, -2}, {1, 2}, {2, -1}, {2, 1}
    };

    static {
        for (int i = 0; i < 64; i++) {
            Square square = Square.of(i);
            long knightBB = 0;
            for (int[] offset : KNIGHT_OFFSETS) {
                Square target = square.offset(offset[0], offset[1]);
                if (target != null) knightBB |= 1L << target.index;
            }
            KNIGHT_ATTACKS_BB[i] = knightBB;

            long kingBB = 0;
            for (Direction direction : Direction.values()) {
                Square target = square.step(direction);
                if (target != null) kingBB |= 1L << target.index;
            }
            KING_ATTACKS_BB[i] = kingBB;
        }
    }

    private AttackUtils() {
    }

    /**
     * Movement rule check for a capture or a defence of {@code to}: whose turn it is, checks and pins
     * are ignored. Pawns only attack diagonally forward.
     */
    public static boolean canAttack(Board board, Square from, Piece piece, Square to) {
        if (from == to) {
            return false;
        }
        return switch (piece.type()) {
            case PAWN -> to.row - from.row == piece.color().forward() && Math.abs(to.col - from.col) == 1;
            case KNIGHT -> (KNIGHT_ATTACKS_BB[from.index] & (1L << to.index)) != 0;
            case KING -> (KING_ATTACKS_BB[from.index] & (1L << to.index)) != 0;
            case BISHOP, ROOK, QUEEN -> {
                Direction direction = Direction.between(from, to);
                yield direction != null
                        && slidesAlong(piece.type(), direction)
                        && walk(board, from, direction, to) == to;
            }
        };
    }

    /**
     * Quiet or capturing move of the piece to {@code to}, ignoring checks. Castling is not a move here.
     */
    public static boolean canMoveTo(Board board, Square from, Piece piece, Square to) {
        Piece occupant = board.get(to);
        if (occupant != null && occupant.color() == piece.color()) {
            return false;
        }
        if (piece.type() != PieceType.PAWN) {
            return canAttack(board, from, piece, to);
        }
        int forward = piece.color().forward();
        if (to.col != from.col) {
            return occupant != null && canAttack(board, from, piece, to);
        }
        if (occupant != null) {
            return false;
        }
        if (to.row - from.row == forward) {
            return true;
        }
        int startRow = piece.color() == Color.WHITE ? 6 : 1;
        return from.row == startRow
                && to.row - from.row == 2 * forward
                && board.isEmpty(from.offset(forward, 0));
    }

    public static boolean slidesAlong(PieceType pieceType, Direction direction) {
        for (Direction d : pieceType.slidingDirections()) {
            if (d == direction) return true;
        }
        return false;
    }

    // First occupied square from `from` (exclusive) along the direction, stopping early at `stopAt`
    private static Square walk(Board board, Square from, Direction direction, Square stopAt) {
        Square current = from.step(direction);
        while (current != null) {
            if (current == stopAt || !board.isEmpty(current)) {
                return current;
            }
            current = current.step(direction);
        }
        return null;
    }

    public static Square firstPieceOnRay(Board board, Square from, Direction direction) {
        return walk(board, from, direction, null);
    }

    /**
     * Occupied squares seen along the ray starting after {@code from}, nearest first, up to {@code limit}.
     */
    public static IntArrayList rayFrom(Board board, Square from, Direction direction, int limit) {
        IntArrayList occupied = new IntArrayList(limit);
        Square current = from;
        while (occupied.size() < limit) {
            current = walk(board, current, direction, null);
            if (current == null) break;
            occupied.add(current.index);
        }
        return occupied;
    }

    /** True when {@code middle} lies strictly between {@code a} and {@code b} on a rank, file or diagonal. */
    public static boolean isBetween(Square a, Square b, Square middle) {
        Direction direction = Direction.between(a, b);
        if (direction == null || middle == a || middle == b) {
            return false;
        }
        Square current = a.step(direction);
        while (current != null && current != b) {
            if (current == middle) return true;
            current = current.step(direction);
        }
        return false;
    }

    public static boolean isPathClear(Board board, Square a, Square b) {
        Direction direction = Direction.between(a, b);
        return direction != null && walk(board, a, direction, b) == b;
    }

    public static IntArrayList attackersOf(Board board, Square square, Color byColor) {
        IntArrayList attackers = new IntArrayList(4);
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece != null && piece.color() == byColor && canAttack(board, Square.of(i), piece, square)) {
                attackers.add(i);
            }
        }
        return attackers;
    }

    public static boolean isAttackedBy(Board board, Square square, Color byColor) {
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece != null && piece.color() == byColor && canAttack(board, Square.of(i), piece, square)) {
                return true;
            }
        }
        return false;
    }

    public static int countAttackers(Board board, Square square, Color byColor) {
        return attackersOf(board, square, byColor).size();
    }

    /** Pieces of {@code color} protecting {@code square}; the occupant of the square never counts. */
    public static int countDefenders(Board board, Square square, Color color) {
        int count = 0;
        for (int i = 0; i < 64; i++) {
            if (i == square.index) continue;
            Piece piece = board.get(i);
            if (piece != null && piece.color() == color && canAttack(board, Square.of(i), piece, square)) {
                count++;
            }
        }
        return count;
    }

    /** Value of the cheapest attacker of {@code byColor}, 0 when there is none. */
    public static int lowestAttackerValue(Board board, Square square, Color byColor) {
        int lowest = 0;
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece != null && piece.color() == byColor && canAttack(board, Square.of(i), piece, square)) {
                if (lowest == 0 || piece.value() < lowest) {
                    lowest = piece.value();
                }
            }
        }
        return lowest;
    }

    /** Value of the cheapest piece of {@code color} able to recapture on {@code square}, 0 when there is none. */
    public static int lowestDefenderValue(Board board, Square square, Color color) {
        return lowestAttackerValue(board, square, color);
    }

    public static boolean isInCheck(Board board, Color color) {
        Square king = board.findKing(color);
        return king != null && isAttackedBy(board, king, color.getOppositeColor());
    }

    /** Pieces of the given colour's opponent giving check. Empty when the king is missing. */
    public static IntArrayList checkers(Board board, Color color) {
        Square king = board.findKing(color);
        if (king == null) {
            return new IntArrayList();
        }
        return attackersOf(board, king, color.getOppositeColor());
    }

    /** Whether the piece standing on {@code square} attacks the enemy king. */
    public static boolean givesCheck(Board board, Square square) {
        Piece piece = board.get(square);
        if (piece == null) return false;
        Square enemyKing = board.findKing(piece.color().getOppositeColor());
        return enemyKing != null && canAttack(board, square, piece, enemyKing);
    }

    /** Squares the king of {@code color} can step to without being attacked, king lifted off its square. */
    public static IntArrayList kingEscapeSquares(Board board, Color color, ScratchBoardPool pool) {
        IntArrayList escapes = new IntArrayList(8);
        Square king = board.findKing(color);
        if (king == null) {
            return escapes;
        }
        Piece kingPiece = board.get(king);
        try (PooledBoard rented = pool.rent(board)) {
            Board scratch = rented.board();
            scratch.clear(king);
            long targets = KING_ATTACKS_BB[king.index];
            while (targets != 0) {
                int index = Long.numberOfTrailingZeros(targets);
                targets &= targets - 1;
                Square target = Square.of(index);
                Piece occupant = board.get(target);
                if (occupant != null && occupant.color() == color) continue;

                scratch.set(target, kingPiece);
                boolean attacked = isAttackedBy(scratch, target, color.getOppositeColor());
                scratch.set(target, occupant);
                if (!attacked) {
                    escapes.add(index);
                }
            }
        }
        return escapes;
    }

    /** Every destination the piece on {@code from} may move to, checks ignored. */
    public static IntArrayList moveTargets(Board board, Square from) {
        IntArrayList targets = new IntArrayList();
        Piece piece = board.get(from);
        if (piece == null) return targets;
        for (int i = 0; i < 64; i++) {
            if (canMoveTo(board, from, piece, Square.of(i))) {
                targets.add(i);
            }
        }
        return targets;
    }

    /**
     * Destinations where the piece on {@code from} is not lost: not attacked there, or only attacked by
     * pieces worth at least as much while defended, or capturing something worth at least as much.
     */
    public static IntArrayList safeSquaresFor(Board board, Square from, ScratchBoardPool pool) {
        IntArrayList safe = new IntArrayList();
        Piece piece = board.get(from);
        if (piece == null) return safe;
        Color enemy = piece.color().getOppositeColor();
        IntArrayList targets = moveTargets(board, from);
        try (PooledBoard rented = pool.rent(board)) {
            Board scratch = rented.board();
            for (int i = 0; i < targets.size(); i++) {
                Square target = Square.of(targets.getInt(i));
                Piece captured = board.get(target);
                scratch.copyFrom(board);
                scratch.clear(from);
                scratch.set(target, piece);
                if (captured != null && captured.value() >= piece.value()) {
                    safe.add(target.index);
                    continue;
                }
                int lowestAttacker = lowestAttackerValue(scratch, target, enemy);
                if (lowestAttacker == 0) {
                    safe.add(target.index);
                } else if (lowestAttacker >= piece.value() && countDefenders(scratch, target, piece.color()) > 0) {
                    safe.add(target.index);
                }
            }
        }
        return safe;
    }

    /**
     * The enemy slider pinning the piece on {@code square} to its own king, or null.
     */
    public static Square pinnerOf(Board board, Square square) {
        Piece piece = board.get(square);
        if (piece == null || piece.type() == PieceType.KING) return null;
        Square king = board.findKing(piece.color());
        if (king == null) return null;
        Direction direction = Direction.between(king, square);
        if (direction == null || walk(board, king, direction, square) != square) {
            return null;
        }
        Square beyond = firstPieceOnRay(board, square, direction);
        if (beyond == null) return null;
        Piece candidate = board.get(beyond);
        if (candidate.color() != piece.color() && candidate.type().isSliding()
                && slidesAlong(candidate.type(), direction)) {
            return beyond;
        }
        return null;
    }

    /** Pieces of {@code color} attacked by the piece standing on {@code from}. */
    public static IntArrayList attackedPieces(Board board, Square from, Color color) {
        IntArrayList attacked = new IntArrayList(4);
        Piece piece = board.get(from);
        if (piece == null) return attacked;
        for (int i = 0; i < 64; i++) {
            Piece target = board.get(i);
            if (target != null && target.color() == color && canAttack(board, from, piece, Square.of(i))) {
                attacked.add(i);
            }
        }
        return attacked;
    }

    /** Attacked squares of the 3x3 ring around the king of {@code color}. */
    public static int attackedSquaresAroundKing(Board board, Color color) {
        Square king = board.findKing(color);
        if (king == null) return 0;
        int count = 0;
        long ring = KING_ATTACKS_BB[king.index];
        while (ring != 0) {
            int index = Long.numberOfTrailingZeros(ring);
            ring &= ring - 1;
            if (isAttackedBy(board, Square.of(index), color.getOppositeColor())) count++;
        }
        return count;
    }
}
