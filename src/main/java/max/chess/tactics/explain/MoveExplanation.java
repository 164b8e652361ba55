package max.chess.tactics.explain;

import max.chess.tactics.defense.Defense;
import max.chess.tactics.detect.DetectionError;
import max.chess.tactics.sacrifice.SacrificeVerdict;
import max.chess.tactics.threat.Threat;

import java.util.List;
import java.util.OptionalInt;

/**
 * Why a move is good, short reasons first. {@code exchangeValue} is only filled for captures
 * when SEE values are shown. {@code errors} lists the analysis steps that gave up.
 */
public record MoveExplanation(List<String> reasons,
                              SacrificeVerdict sacrifice,
                              OptionalInt exchangeValue,
                              List<Defense> defenses,
                              List<Threat> threats,
                              List<DetectionError> errors) {

    public MoveExplanation {
        reasons = List.copyOf(reasons);
        defenses = List.copyOf(defenses);
        threats = List.copyOf(threats);
        errors = List.copyOf(errors);
    }

    static MoveExplanation fallback(String reason, DetectionError error) {
        return new MoveExplanation(List.of(reason), SacrificeVerdict.NONE, OptionalInt.empty(),
                List.of(), List.of(), error == null ? List.of() : List.of(error));
    }

    public String text() {
        return String.join(", ", reasons);
    }

    @Override
    public String toString() {
        return text();
    }
}
