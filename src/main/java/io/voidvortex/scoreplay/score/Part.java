package io.voidvortex.scoreplay.score;

import java.util.List;

/**
 * An instrument part. Percussion parts are routed to MIDI channel 9 unless mapped explicitly.
 */
public record Part(String id, String name, List<Staff> staves, boolean percussion) {

    public Part {
        staves = List.copyOf(staves);
    }

    public static Part of(String id, String name, Staff... staves) {
        return new Part(id, name, List.of(staves), false);
    }

    public Part asPercussion() {
        return new Part(id, name, staves, true);
    }
}
