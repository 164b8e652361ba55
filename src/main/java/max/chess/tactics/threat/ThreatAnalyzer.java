package max.chess.tactics.threat;

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
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Move;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Threats on the board in two directions: the ones a move creates for the mover, and the
 * ones the opponent already holds against the side to move.
 */
public final class ThreatAnalyzer {
    private static final int MAX_THREATS = 3;

    private final AnalysisConfig config;
    private final ScratchBoardPool pool;

    public ThreatAnalyzer(AnalysisConfig config, ScratchBoardPool pool) {
        this.config = config;
        this.pool = pool;
    }

    /** New threats {@code color} creates by playing {@code move}; threats that already existed are left out. */
    public List<Threat> analyzeThreatsAfterMove(Board board, Move move, Color color) {
        List<Threat> threats = new ArrayList<>();
        try {
            if (board.get(move.from()) == null) {
                return List.of();
            }
            List<Threat> before = new ArrayList<>();
            detectWinnablePieces(board, color, before);
            detectPins(board, color, before);
            detectPromotionThreats(board, color, before);

            try (PooledBoard scratch = pool.rent(board)) {
                Board after = scratch.board();
                after.applyMove(move);
                detectCheck(after, move.to(), color, threats);
                detectWinnablePieces(after, color, threats);
                detectFork(after, move.to(), color, threats);
                detectPins(after, color, threats);
                detectPromotionThreats(after, color, threats);
                detectTrappedPieces(after, color, threats);
            }

            Set<String> existing = new HashSet<>();
            for (Threat threat : before) {
                existing.add(threat.description());
            }
            threats.removeIf(threat -> existing.contains(threat.description()));
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("Threat analysis failed on " + move + ": " + e);
            }
        }
        return topThreats(threats);
    }

    /** What the opponent of {@code color} threatens right now, before {@code color} moves. */
    public List<Threat> analyzeOpponentThreats(Board board, Color color) {
        List<Threat> threats = new ArrayList<>();
        Color opponent = color.getOppositeColor();
        try {
            if (AttackUtils.isInCheck(board, color)) {
                threats.add(new Threat("king is in check!", ThreatType.CHECK, 5, board.findKing(color)));
            }
            detectOpponentCaptures(board, opponent, threats);
            detectOpponentForks(board, opponent, threats);
            detectOpponentPromotions(board, opponent, threats);
            detectPinsAgainst(board, color, threats);
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("Opponent threat analysis failed: " + e);
            }
        }
        return topThreats(threats);
    }

    private static List<Threat> topThreats(List<Threat> threats) {
        Map<String, Threat> unique = new LinkedHashMap<>();
        for (Threat threat : threats) {
            unique.putIfAbsent(threat.description(), threat);
        }
        return unique.values().stream()
                .sorted(Comparator.comparingInt(Threat::severity).reversed())
                .limit(MAX_THREATS)
                .toList();
    }

    private void detectCheck(Board after, Square pieceSquare, Color us, List<Threat> threats) {
        Color them = us.getOppositeColor();
        Square king = after.findKing(them);
        Piece piece = after.get(pieceSquare);
        if (king == null || piece == null) return;
        if (!AttackUtils.canAttack(after, pieceSquare, piece, king)) return;

        threats.add(new Threat("gives check", ThreatType.CHECK, 4, king));
        if (AttackUtils.kingEscapeSquares(after, them, pool).size() <= 1) {
            threats.add(new Threat("threatens checkmate", ThreatType.CHECKMATE_THREAT, 5, king));
        }
    }

    // Enemy pieces we attack that cannot simply walk away, or are worth more than our cheapest attacker
    private void detectWinnablePieces(Board board, Color us, List<Threat> threats) {
        Color them = us.getOppositeColor();
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece == null || piece.color() != them || piece.type() == PieceType.KING) continue;
            Square square = Square.of(i);
            if (!AttackUtils.isAttackedBy(board, square, us)) continue;

            String where = piece.displayName() + " on " + square.name();
            if (!AttackUtils.isAttackedBy(board, square, them)) {
                if (!canEscape(board, square)) {
                    threats.add(new Threat("wins " + where, ThreatType.HANGING_PIECE, Math.min(piece.value(), 5), square));
                } else if (piece.value() >= 3) {
                    threats.add(new Threat("attacks " + where, ThreatType.MATERIAL_WIN, Math.min(piece.value() - 1, 3), square));
                }
            } else if (piece.value() >= 3) {
                int lowestAttacker = AttackUtils.lowestAttackerValue(board, square, us);
                if (lowestAttacker > 0 && lowestAttacker < piece.value() && !canEscape(board, square)) {
                    threats.add(new Threat("threatens " + where, ThreatType.MATERIAL_WIN,
                            Math.min(piece.value() - lowestAttacker + 1, 4), square));
                }
            }
        }
    }

    private static void detectFork(Board board, Square from, Color us, List<Threat> threats) {
        List<String> names = valuableTargets(board, from, us.getOppositeColor());
        if (names.size() >= 2) {
            threats.add(new Threat("forks " + names.get(0) + " and " + names.get(1), ThreatType.FORK, 5, from));
        }
    }

    private static void detectOpponentForks(Board board, Color opponent, List<Threat> threats) {
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece == null || piece.color() != opponent) continue;
            Square from = Square.of(i);
            List<String> names = valuableTargets(board, from, opponent.getOppositeColor());
            if (names.size() >= 2) {
                threats.add(new Threat("opponent forks " + names.get(0) + " and " + names.get(1), ThreatType.FORK, 5, from));
            }
        }
    }

    // Names of the pieces worth 3 or more, kings included, hit by the piece on `from`
    private static List<String> valuableTargets(Board board, Square from, Color targetColor) {
        List<String> names = new ArrayList<>(2);
        IntArrayList attacked = AttackUtils.attackedPieces(board, from, targetColor);
        for (int i = 0; i < attacked.size(); i++) {
            Piece target = board.get(attacked.getInt(i));
            if (target.value() >= 3) {
                names.add(target.displayName());
            }
        }
        return names;
    }

    private void detectPins(Board board, Color us, List<Threat> threats) {
        Color them = us.getOppositeColor();
        for (int i = 0; i < 64; i++) {
            Piece slider = board.get(i);
            if (slider == null || slider.color() != us || !slider.type().isSliding()) continue;
            Square from = Square.of(i);
            for (Direction direction : slider.type().slidingDirections()) {
                Threat pin = pinAlong(board, from, slider, direction, them);
                if (pin != null) {
                    threats.add(pin);
                    break;
                }
            }
        }
    }

    private Threat pinAlong(Board board, Square from, Piece slider, Direction direction, Color them) {
        IntArrayList ray = AttackUtils.rayFrom(board, from, direction, 2);
        if (ray.size() < 2) return null;
        Square frontSquare = Square.of(ray.getInt(0));
        Square behindSquare = Square.of(ray.getInt(1));
        Piece front = board.get(frontSquare);
        Piece behind = board.get(behindSquare);
        if (front.color() != them || behind.color() != them) return null;
        if (behind.value() <= front.value()) return null;

        boolean absolute = behind.type() == PieceType.KING;
        if (!absolute) {
            boolean behindDefended;
            try (PooledBoard scratch = pool.rent(board)) {
                scratch.board().clear(frontSquare);
                behindDefended = AttackUtils.isAttackedBy(scratch.board(), behindSquare, them);
            }
            if (behindDefended && behind.value() <= slider.value()) return null;
        }
        return new Threat("pins " + front.displayName() + " on " + frontSquare.name() + " to " + behind.displayName(),
                ThreatType.PIN, absolute ? 4 : 3, frontSquare);
    }

    private void detectPinsAgainst(Board board, Color us, List<Threat> threats) {
        Square king = board.findKing(us);
        if (king == null) return;
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece == null || piece.color() != us || piece.type() == PieceType.KING) continue;
            Square square = Square.of(i);
            if (AttackUtils.pinnerOf(board, square) != null) {
                threats.add(new Threat("our " + piece.displayName() + " on " + square.name() + " is pinned",
                        ThreatType.PIN, 3, square));
            }
        }
    }

    private static void detectPromotionThreats(Board board, Color us, List<Threat> threats) {
        int row = us.promotionRank() - us.forward();
        for (int col = 0; col < 8; col++) {
            Square square = Square.of(row, col);
            if (!Piece.of(PieceType.PAWN, us).equals(board.get(square))) continue;
            Piece blocker = board.get(Square.of(us.promotionRank(), col));
            if (blocker == null || blocker.color() != us) {
                threats.add(new Threat(square.file() + "-pawn threatens promotion", ThreatType.PROMOTION, 5, square));
            }
        }
    }

    private static void detectOpponentPromotions(Board board, Color opponent, List<Threat> threats) {
        int row = opponent.promotionRank() - opponent.forward();
        for (int col = 0; col < 8; col++) {
            Square square = Square.of(row, col);
            if (Piece.of(PieceType.PAWN, opponent).equals(board.get(square))) {
                threats.add(new Threat("opponent's " + square.file() + "-pawn threatens promotion", ThreatType.PROMOTION, 5, square));
            }
        }
    }

    private void detectTrappedPieces(Board board, Color us, List<Threat> threats) {
        Color them = us.getOppositeColor();
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece == null || piece.color() != them) continue;
            if (piece.type() == PieceType.PAWN || piece.type() == PieceType.KING) continue;
            Square square = Square.of(i);
            if (!AttackUtils.isAttackedBy(board, square, us) || AttackUtils.isAttackedBy(board, square, them)) continue;
            if (!canEscape(board, square)) {
                threats.add(new Threat(piece.displayName() + " on " + square.name() + " is trapped",
                        ThreatType.TRAPPED_PIECE, Math.min(piece.value(), 5), square));
            }
        }
    }

    private void detectOpponentCaptures(Board board, Color opponent, List<Threat> threats) {
        Color us = opponent.getOppositeColor();
        for (int i = 0; i < 64; i++) {
            Piece piece = board.get(i);
            if (piece == null || piece.color() != us || piece.type() == PieceType.KING) continue;
            Square square = Square.of(i);
            if (!AttackUtils.isAttackedBy(board, square, opponent)) continue;

            String where = piece.displayName() + " on " + square.name();
            if (!AttackUtils.isAttackedBy(board, square, us)) {
                if (!canEscape(board, square)) {
                    threats.add(new Threat(where + " is hanging", ThreatType.HANGING_PIECE, Math.min(piece.value(), 5), square));
                } else if (piece.value() >= 3) {
                    threats.add(new Threat(where + " is attacked", ThreatType.MATERIAL_WIN, 2, square));
                }
            } else if (piece.value() >= 3) {
                int lowestAttacker = AttackUtils.lowestAttackerValue(board, square, opponent);
                if (lowestAttacker > 0 && lowestAttacker < piece.value() && !canEscape(board, square)) {
                    threats.add(new Threat(where + " under attack", ThreatType.MATERIAL_WIN,
                            Math.min(piece.value() - lowestAttacker, 4), square));
                }
            }
        }
    }

    // At least one destination where the piece is not attacked at all
    private boolean canEscape(Board board, Square square) {
        Piece piece = board.get(square);
        Color enemy = piece.color().getOppositeColor();
        IntArrayList targets = AttackUtils.moveTargets(board, square);
        try (PooledBoard rented = pool.rent(board)) {
            Board scratch = rented.board();
            for (int i = 0; i < targets.size(); i++) {
                Square target = Square.of(targets.getInt(i));
                scratch.copyFrom(board);
                scratch.clear(square);
                scratch.set(target, piece);
                if (!AttackUtils.isAttackedBy(scratch, target, enemy)) {
                    return true;
                }
            }
        }
        return false;
    }
}
