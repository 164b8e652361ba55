package max.chess.tactics.defense;

import max.chess.tactics.board.AttackUtils;
import max.chess.tactics.board.Board;
import max.chess.tactics.board.pool.PooledBoard;
import max.chess.tactics.board.pool.ScratchBoardPool;
import max.chess.tactics.common.Color;
import max.chess.tactics.common.Piece;
import max.chess.tactics.common.PieceType;
import max.chess.tactics.common.Square;
import max.chess.tactics.config.AnalysisConfig;
import max.chess.tactics.notation.Move;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What a move protects: newly defended pieces, an attacked piece stepping to safety,
 * an interposition, and king safety. Only the two most important defences are kept.
 */
public final class DefenseAnalyzer {
    private static final int MAX_DEFENSES = 2;

    private final AnalysisConfig config;
    private final ScratchBoardPool pool;
    private final MateThreats mateThreats;

    public DefenseAnalyzer(AnalysisConfig config, ScratchBoardPool pool) {
        this.config = config;
        this.pool = pool;
        this.mateThreats = new MateThreats(pool);
    }

    public List<Defense> analyzeDefenses(Board board, Move move, Color color) {
        List<Defense> defenses = new ArrayList<>();
        try {
            Piece moving = board.get(move.from());
            if (moving == null || moving.color() != color) {
                return List.of();
            }
            try (PooledBoard scratch = pool.rent(board)) {
                Board after = scratch.board();
                after.applyMove(move);
                detectNewlyDefendedPieces(board, after, move, color, defenses);
                detectEscape(board, after, move, moving, color, defenses);
                detectBlocking(board, after, move, color, defenses);
                detectKingSafety(board, after, color, defenses);
            }
        } catch (RuntimeException e) {
            if (config.debug) {
                System.err.println("Defense analysis failed on " + move + ": " + e);
            }
        }

        Map<String, Defense> unique = new LinkedHashMap<>();
        for (Defense defense : defenses) {
            unique.putIfAbsent(defense.description(), defense);
        }
        return unique.values().stream()
                .sorted(Comparator.comparingInt(Defense::importance).reversed())
                .limit(MAX_DEFENSES)
                .toList();
    }

    private static void detectNewlyDefendedPieces(Board before, Board after, Move move, Color us, List<Defense> defenses) {
        Color them = us.getOppositeColor();
        for (int i = 0; i < 64; i++) {
            Piece piece = after.get(i);
            if (piece == null || piece.color() != us || piece.type() == PieceType.KING) continue;
            Square square = Square.of(i);
            // the moved piece cannot defend itself
            if (square == move.to()) continue;

            if (!AttackUtils.isAttackedBy(before, square, them)) continue;
            int defendersBefore = AttackUtils.countDefenders(before, square, us);
            int attackersBefore = AttackUtils.countAttackers(before, square, them);
            int defendersAfter = AttackUtils.countDefenders(after, square, us);
            int attackersAfter = AttackUtils.countAttackers(after, square, them);

            boolean wasVulnerable = defendersBefore == 0 || attackersBefore > defendersBefore;
            boolean isNowSafe = defendersAfter > 0 && defendersAfter >= attackersAfter;
            if (wasVulnerable && isNowSafe && defendersAfter > defendersBefore) {
                DefenseType type = piece.type() == PieceType.PAWN ? DefenseType.PROTECT_PAWN : DefenseType.PROTECT_PIECE;
                defenses.add(new Defense("defends " + piece.displayName() + " on " + square.name(),
                        type, Math.min(piece.value(), 5), square));
            }
        }
    }

    private static void detectEscape(Board before, Board after, Move move, Piece moving, Color us, List<Defense> defenses) {
        if (moving.type() == PieceType.KING || moving.value() < 3) return;
        Color them = us.getOppositeColor();
        int attackers = AttackUtils.countAttackers(before, move.from(), them);
        if (attackers == 0) return;
        int defenders = AttackUtils.countDefenders(before, move.from(), us);
        int lowestAttacker = AttackUtils.lowestAttackerValue(before, move.from(), them);
        boolean inDanger = lowestAttacker < moving.value() || attackers > defenders;
        if (!inDanger) return;

        if (!AttackUtils.isAttackedBy(after, move.to(), them)) {
            defenses.add(new Defense("saves " + moving.displayName(), DefenseType.ESCAPE,
                    Math.min(moving.value() - 1, 4), move.to()));
        }
    }

    private static void detectBlocking(Board before, Board after, Move move, Color us, List<Defense> defenses) {
        Color them = us.getOppositeColor();
        for (int i = 0; i < 64; i++) {
            Piece piece = before.get(i);
            if (piece == null || piece.color() != us || i == move.from().index) continue;
            if (piece.type() != PieceType.KING && piece.value() < 3) continue;
            Square square = Square.of(i);
            if (!wasAttackedThrough(before, square, move.to(), them)) continue;
            if (AttackUtils.isAttackedBy(after, square, them)) continue;

            int importance = Math.min(piece.value() / 2 + 1, 4);
            defenses.add(new Defense("blocks attack on " + piece.displayName(), DefenseType.BLOCK_ATTACK, importance, square));
        }
    }

    private static boolean wasAttackedThrough(Board before, Square target, Square through, Color them) {
        var attackers = AttackUtils.attackersOf(before, target, them);
        for (int i = 0; i < attackers.size(); i++) {
            Square attacker = Square.of(attackers.getInt(i));
            if (before.get(attacker).type().isSliding() && AttackUtils.isBetween(attacker, target, through)) {
                return true;
            }
        }
        return false;
    }

    private void detectKingSafety(Board before, Board after, Color us, List<Defense> defenses) {
        Square king = after.findKing(us);
        if (king == null) return;
        if (AttackUtils.isInCheck(before, us) && !AttackUtils.isInCheck(after, us)) {
            defenses.add(new Defense("gets out of check", DefenseType.PROTECT_KING, 5, king));
            return;
        }
        Color them = us.getOppositeColor();
        if (mateThreats.findMateInOne(before, them) != null && mateThreats.findMateInOne(after, them) == null) {
            defenses.add(new Defense("stops mate threat", DefenseType.PREVENT_MATE, 5, king));
            return;
        }
        int attackedBefore = AttackUtils.attackedSquaresAroundKing(before, us);
        int attackedAfter = AttackUtils.attackedSquaresAroundKing(after, us);
        if (attackedBefore >= 2 && attackedAfter < attackedBefore) {
            defenses.add(new Defense("improves king safety", DefenseType.PROTECT_KING, 3, king));
        }
    }
}
