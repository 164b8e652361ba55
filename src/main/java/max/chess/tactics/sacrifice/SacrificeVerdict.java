package max.chess.tactics.sacrifice;

import java.util.Optional;

/**
 * How a move trades material. {@code text} is the wording shown to the user and is only
 * present for sacrifices.
 */
public record SacrificeVerdict(SacrificeKind kind, boolean sacrifice, boolean brilliant, String text) {
    public static final SacrificeVerdict NONE = new SacrificeVerdict(SacrificeKind.NONE, false, false, null);

    static SacrificeVerdict of(SacrificeKind kind) {
        return new SacrificeVerdict(kind, false, false, null);
    }

    static SacrificeVerdict sacrifice(SacrificeKind kind, String text) {
        return new SacrificeVerdict(kind, true, kind == SacrificeKind.BRILLIANT, text);
    }

    public Optional<String> description() {
        return Optional.ofNullable(text);
    }
}
