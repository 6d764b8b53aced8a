package io.voidvortex.scoreplay.score;

import org.jetbrains.annotations.Nullable;

/**
 * A duration-bearing event inside a voice: either a {@link NoteEvent} or a {@link RestEvent}.
 */
public sealed interface VoiceEvent permits NoteEvent, RestEvent {

    String id();

    Duration duration();

    int dots();

    @Nullable
    Tuplet tuplet();

    /**
     * Shared construction checks. A missing duration or an unsupported dot count is a
     * caller error and is never coerced.
     */
    static void checkRhythm(String id, Duration duration, int dots) {
        if (id == null)
            throw new IllegalArgumentException("event id is required");
        if (duration == null)
            throw new IllegalArgumentException("event " + id + " has no duration");
        if (dots < 0 || dots > 2)
            throw new IllegalArgumentException("event " + id + " has unsupported dot count " + dots);
    }
}
