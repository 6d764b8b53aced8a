package io.voidvortex.scoreplay.score;

import org.jetbrains.annotations.Nullable;

public record RestEvent(String id, Duration duration, int dots, @Nullable Tuplet tuplet) implements VoiceEvent {

    public RestEvent {
        VoiceEvent.checkRhythm(id, duration, dots);
    }

    public static RestEvent of(String id, Duration duration) {
        return new RestEvent(id, duration, 0, null);
    }
}
