package io.voidvortex.scoreplay.score;

import java.util.List;

/**
 * Immutable snapshot of an already validated score. This is the only input the playback and
 * export code consumes; editing and validation live elsewhere.
 */
public record Score(String id, String title, List<Part> parts, List<Slur> slurs, List<Hairpin> hairpins) {

    public Score {
        parts = List.copyOf(parts);
        slurs = slurs == null ? List.of() : List.copyOf(slurs);
        hairpins = hairpins == null ? List.of() : List.copyOf(hairpins);
    }

    public static Score of(String title, Part... parts) {
        return new Score("score", title, List.of(parts), List.of(), List.of());
    }

    public Score withHairpins(Hairpin... hairpins) {
        return new Score(id, title, parts, slurs, List.of(hairpins));
    }
}
