package io.voidvortex.scoreplay.playback;

import io.voidvortex.scoreplay.score.Hairpin;
import io.voidvortex.scoreplay.score.Measure;
import io.voidvortex.scoreplay.score.NoteEvent;
import io.voidvortex.scoreplay.score.Part;
import io.voidvortex.scoreplay.score.Score;
import io.voidvortex.scoreplay.score.Staff;
import io.voidvortex.scoreplay.score.Voice;
import io.voidvortex.scoreplay.score.VoiceEvent;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks the traversal of every staff and turns its notes into {@link PlaybackEvent}s.
 * <p>
 * Staves are timed independently because their measure and repeat structure may differ (a
 * pickup staff, for instance). Within a staff, each visited measure starts where the previous
 * visits ended; a measure lasts as long as its longest voice. Strict mode plays durations and
 * timing literally, expressive mode additionally applies articulation shapes and hairpins.
 */
public final class PlaybackGenerator {

    public static final int DEFAULT_VELOCITY = 84;
    public static final int HAIRPIN_RANGE = 16;

    private PlaybackGenerator() {
    }

    public static GeneratorResult generate(Score score) {
        return generate(score, false, MeasureTraversal.DEFAULT_MAX_VISITS);
    }

    public static GeneratorResult generate(Score score, boolean expressive) {
        return generate(score, expressive, MeasureTraversal.DEFAULT_MAX_VISITS);
    }

    public static GeneratorResult generate(Score score, boolean expressive, int maxVisits) {
        ScoreIndex index = ScoreIndex.of(score);
        Map<String, Integer> hairpinOffsets = expressive ? hairpinOffsets(score, index) : Map.of();

        List<PlaybackEvent> events = new ArrayList<>();
        ResolverResult longest = null;
        for (Part part : score.parts()) {
            for (Staff staff : part.staves()) {
                ResolverResult traversal = MeasureTraversal.resolve(staff.measures(), maxVisits);
                if (longest == null || traversal.order().size() > longest.order().size())
                    longest = traversal;
                generateStaff(staff, traversal, expressive, hairpinOffsets, events);
            }
        }
        events.sort(PlaybackEvent.TIMELINE_ORDER);
        return new GeneratorResult(events, longest != null ? longest : ResolverResult.EMPTY);
    }

    /**
     * Length of a measure: the longest of its voices, polyphonic voices sharing the start tick.
     */
    public static long measureTicks(Measure measure) {
        long longest = 0;
        for (Voice voice : measure.voices()) {
            long total = 0;
            for (VoiceEvent event : voice.events())
                total += TickModel.toTicks(event);
            longest = Math.max(longest, total);
        }
        return longest;
    }

    // ────────────────────────── inner helpers ────────────────────────────

    private static void generateStaff(Staff staff,
                                      ResolverResult traversal,
                                      boolean expressive,
                                      Map<String, Integer> hairpinOffsets,
                                      List<PlaybackEvent> out) {
        Map<String, Measure> measuresById = new HashMap<>();
        for (Measure m : staff.measures())
            measuresById.putIfAbsent(m.id(), m);

        long measureStart = 0;
        for (MeasureVisit visit : traversal.order()) {
            Measure measure = measuresById.get(visit.measureId());
            for (Voice voice : measure.voices()) {
                long localTick = 0;
                for (VoiceEvent event : voice.events()) {
                    int ticks = TickModel.toTicks(event);
                    if (event instanceof NoteEvent note)
                        out.add(toPlaybackEvent(note, measureStart + localTick, ticks, expressive, hairpinOffsets));
                    localTick += ticks;
                }
            }
            measureStart += measureTicks(measure);
        }
    }

    private static PlaybackEvent toPlaybackEvent(NoteEvent note,
                                                 long onset,
                                                 int ticks,
                                                 boolean expressive,
                                                 Map<String, Integer> hairpinOffsets) {
        int pitch = note.pitch().midiNumber();
        if (pitch < 0 || pitch > 127)
            throw new IllegalArgumentException("note " + note.id() + " spells MIDI pitch " + pitch + " outside 0-127");

        int velocity = note.dynamic() != null ? note.dynamic().velocity : DEFAULT_VELOCITY;
        int duration = ticks;
        long tick = onset;
        if (expressive) {
            ArticulationShape shape = ArticulationShape.of(note);
            duration = shape.shapeDuration(ticks);
            tick = Math.max(0, onset + shape.timingOffsetTicks());
            velocity += shape.velocityDelta() + hairpinOffsets.getOrDefault(note.id(), 0);
        }
        velocity = Math.max(1, Math.min(127, velocity));
        return new PlaybackEvent(note.id(), tick, Math.max(1, duration), pitch, velocity,
                new ArrayList<>(note.articulations()));
    }

    /**
     * Linear velocity ramp between the endpoints of each hairpin, measured in document-order
     * index distance. Later hairpins win where spans overlap.
     */
    static Map<String, Integer> hairpinOffsets(Score score, ScoreIndex index) {
        Map<String, Integer> offsets = new HashMap<>();
        List<VoiceEvent> order = index.documentOrder();
        for (Hairpin hairpin : score.hairpins()) {
            ScoreIndex.Entry from = index.get(hairpin.from());
            ScoreIndex.Entry to = index.get(hairpin.to());
            if (from == null || to == null || to.documentIndex() <= from.documentIndex())
                continue;
            int start = from.documentIndex();
            int span = to.documentIndex() - start;
            int sign = hairpin.type() == Hairpin.Type.CRESCENDO ? 1 : -1;
            for (int i = start; i <= to.documentIndex(); i++) {
                int amount = (int) Math.round((double) (i - start) / span * HAIRPIN_RANGE);
                offsets.put(order.get(i).id(), sign * amount);
            }
        }
        return offsets;
    }
}
