package io.voidvortex.scoreplay.playback;

import io.voidvortex.scoreplay.score.Articulation;

import java.util.Comparator;
import java.util.List;

/**
 * A timed, shaped note. This is the single contract shared by real-time audition and file
 * export, so what is heard and what is written can be compared event by event.
 *
 * @param sourceEventId id of the {@link io.voidvortex.scoreplay.score.NoteEvent} it was generated from
 * @param tick          absolute onset
 * @param durationTicks sounding length, at least 1
 * @param pitch         MIDI note number 0-127
 * @param velocity      1-127
 */
public record PlaybackEvent(String sourceEventId,
                            long tick,
                            int durationTicks,
                            int pitch,
                            int velocity,
                            List<Articulation> articulationContext) {

    /**
     * Timeline order: tick ascending, ties broken by source id so the result does not depend on
     * staff iteration order.
     */
    public static final Comparator<PlaybackEvent> TIMELINE_ORDER =
            Comparator.comparingLong(PlaybackEvent::tick).thenComparing(PlaybackEvent::sourceEventId);

    public PlaybackEvent {
        if (tick < 0)
            throw new IllegalArgumentException("negative tick " + tick + " for " + sourceEventId);
        if (durationTicks < 1)
            throw new IllegalArgumentException("duration must be at least one tick for " + sourceEventId);
        if (pitch < 0 || pitch > 127)
            throw new IllegalArgumentException("pitch " + pitch + " out of MIDI range for " + sourceEventId);
        if (velocity < 1 || velocity > 127)
            throw new IllegalArgumentException("velocity " + velocity + " out of range for " + sourceEventId);
        articulationContext = List.copyOf(articulationContext);
    }

    public long endTick() {
        return tick + durationTicks;
    }
}
