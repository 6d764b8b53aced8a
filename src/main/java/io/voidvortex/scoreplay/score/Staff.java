package io.voidvortex.scoreplay.score;

import java.util.List;

public record Staff(String id, Clef clef, List<Measure> measures) {

    public Staff {
        measures = List.copyOf(measures);
    }

    public static Staff of(String id, Measure... measures) {
        return new Staff(id, Clef.TREBLE, List.of(measures));
    }
}
