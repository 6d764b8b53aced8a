package io.voidvortex.scoreplay.score;

import java.util.Objects;

/**
 * Crescendo or diminuendo spanning two events, referenced by id.
 */
public record Hairpin(String id, String from, String to, Type type) {

    public enum Type {
        CRESCENDO,
        DIMINUENDO
    }

    public Hairpin {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(type, "type");
    }
}
