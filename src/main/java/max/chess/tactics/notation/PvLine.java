package max.chess.tactics.notation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One principal variation: "e2e4 e7e5 g1f3+ (+0.35)". Tokens keep their spelling so
 * repetition can be spotted by comparing them; '+' and '#' suffixes mark checking moves.
 */
public record PvLine(List<String> moves, Optional<Evaluation> evaluation) {

    public PvLine {
        moves = Collections.unmodifiableList(new ArrayList<>(moves));
    }

    public static PvLine parse(String text) {
        List<String> moves = new ArrayList<>();
        Optional<Evaluation> evaluation = Optional.empty();
        if (text == null) {
            return new PvLine(moves, evaluation);
        }
        String body = text.trim();
        if (body.endsWith(")")) {
            int open = body.lastIndexOf('(');
            if (open >= 0) {
                evaluation = Evaluation.parse(body.substring(open + 1, body.length() - 1));
                body = body.substring(0, open).trim();
            }
        }
        for (String token : body.split("\\s+")) {
            if (!token.isEmpty()) {
                moves.add(token);
            }
        }
        return new PvLine(moves, evaluation);
    }

    public int size() {
        return moves.size();
    }

    public boolean isEmpty() {
        return moves.isEmpty();
    }

    public boolean isCheck(int ply) {
        String move = moves.get(ply);
        return move.indexOf('+') >= 0 || move.indexOf('#') >= 0;
    }

    public int checkCount() {
        int count = 0;
        for (int i = 0; i < moves.size(); i++) {
            if (isCheck(i)) count++;
        }
        return count;
    }

    /** The ply as a move code when it is one ("g1f3+" gives g1f3), empty for SAN tokens. */
    public Optional<Move> moveAt(int ply) {
        if (ply < 0 || ply >= moves.size()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Move.fromAlgebraicNotation(MoveIOUtils.stripAnnotations(moves.get(ply))));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
