package io.voidvortex.scoreplay.score;

import java.util.List;

public record Voice(String id, List<VoiceEvent> events) {

    public Voice {
        events = List.copyOf(events);
    }

    public static Voice of(String id, VoiceEvent... events) {
        return new Voice(id, List.of(events));
    }
}
