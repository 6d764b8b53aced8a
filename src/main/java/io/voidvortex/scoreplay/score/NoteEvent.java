package io.voidvortex.scoreplay.score;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * A sounding note. Ties are expressed by id: {@code tieStartId} names the next note of the
 * chain, {@code tieEndId} the previous one.
 */
public record NoteEvent(String id,
                        Duration duration,
                        int dots,
                        @Nullable Tuplet tuplet,
                        Pitch pitch,
                        @Nullable String tieStartId,
                        @Nullable String tieEndId,
                        Set<Articulation> articulations,
                        @Nullable Dynamic dynamic) implements VoiceEvent {

    public NoteEvent {
        VoiceEvent.checkRhythm(id, duration, dots);
        if (pitch == null)
            throw new IllegalArgumentException("note " + id + " has no pitch");
        articulations = articulations == null || articulations.isEmpty()
                ? Set.of()
                : Collections.unmodifiableSet(EnumSet.copyOf(articulations));
    }

    public static NoteEvent of(String id, Pitch pitch, Duration duration) {
        return new NoteEvent(id, duration, 0, null, pitch, null, null, Set.of(), null);
    }

    public NoteEvent withDots(int dots) {
        return new NoteEvent(id, duration, dots, tuplet, pitch, tieStartId, tieEndId, articulations, dynamic);
    }

    public NoteEvent withTuplet(Tuplet tuplet) {
        return new NoteEvent(id, duration, dots, tuplet, pitch, tieStartId, tieEndId, articulations, dynamic);
    }

    public NoteEvent withDynamic(Dynamic dynamic) {
        return new NoteEvent(id, duration, dots, tuplet, pitch, tieStartId, tieEndId, articulations, dynamic);
    }

    public NoteEvent withArticulations(Articulation... articulations) {
        return new NoteEvent(id, duration, dots, tuplet, pitch, tieStartId, tieEndId, Set.copyOf(Arrays.asList(articulations)), dynamic);
    }

    public NoteEvent tiedTo(String nextNoteId) {
        return new NoteEvent(id, duration, dots, tuplet, pitch, nextNoteId, tieEndId, articulations, dynamic);
    }

    public NoteEvent tiedFrom(String previousNoteId) {
        return new NoteEvent(id, duration, dots, tuplet, pitch, tieStartId, previousNoteId, articulations, dynamic);
    }

    public boolean has(Articulation articulation) {
        return articulations.contains(articulation);
    }
}
