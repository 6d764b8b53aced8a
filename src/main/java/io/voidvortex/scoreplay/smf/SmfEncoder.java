package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.DebugSink;
import io.voidvortex.scoreplay.playback.MeasureTraversal;
import io.voidvortex.scoreplay.playback.MeasureVisit;
import io.voidvortex.scoreplay.playback.PlaybackEvent;
import io.voidvortex.scoreplay.playback.PlaybackGenerator;
import io.voidvortex.scoreplay.playback.ScoreIndex;
import io.voidvortex.scoreplay.playback.TickModel;
import io.voidvortex.scoreplay.score.KeySignature;
import io.voidvortex.scoreplay.score.Measure;
import io.voidvortex.scoreplay.score.NoteEvent;
import io.voidvortex.scoreplay.score.Part;
import io.voidvortex.scoreplay.score.Score;
import io.voidvortex.scoreplay.score.TimeSignature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static io.voidvortex.scoreplay.smf.MidiUtil.*;
import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Converts a score into a type 1 Standard MIDI File: one conductor track with tempo, meter and
 * key changes, then one track per part.
 */
public final class SmfEncoder {

    private SmfEncoder() {
    }

    // ───────────────────────── public API ────────────────────────────────

    public static byte[] encode(Score score) {
        return encode(score, ExportOptions.defaults());
    }

    public static byte[] encode(Score score, ExportOptions options) {
        return new SmfWriter(options.sink()).write(build(score, options));
    }

    /**
     * Builds the container without serializing it.
     *
     * @throws IllegalArgumentException when a supplied playback event does not name a note of the score
     */
    public static SmfFile build(Score score, ExportOptions options) {
        DebugSink dbg = options.sink();
        ScoreIndex index = ScoreIndex.of(score);
        List<PlaybackEvent> events = options.usePlaybackEvents() != null
                ? options.usePlaybackEvents()
                : PlaybackGenerator.generate(score, false, options.maxVisits()).events();

        List<List<PlaybackEvent>> byPart = routeToParts(score, index, events);
        Random random = options.humanize() != null ? new Random(options.humanize().seed()) : null;

        List<SmfTrack> tracks = new ArrayList<>();
        tracks.add(conductorTrack(score, options.maxVisits(), dbg));
        for (int p = 0; p < score.parts().size(); p++) {
            Part part = score.parts().get(p);
            ChannelMapping mapping = options.partChannelMapping()
                    .getOrDefault(part.id(), ChannelMapping.defaultFor(p, part.percussion()));
            List<Region> regions = mergeTies(byPart.get(p), index);
            if (random != null)
                humanize(regions, options.humanize(), random);
            dbg.log(String.format("[DEBUG] Part %s -> channel %d program %d, %d regions",
                    part.id(), mapping.channel(), mapping.program(), regions.size()));
            tracks.add(partTrack(part, mapping, regions));
        }
        return new SmfFile(new SmfHeader(FORMAT_MULTI_TRACK, tracks.size(), TickModel.PPQ), tracks);
    }

    // ──────────────────────── conductor track ─────────────────────────────

    private record Conductor(int bpm, TimeSignature time, KeySignature key) {
    }

    /**
     * Tempo, time and key at tick 0 and at every measure start where one of them changes,
     * following the performance order of the first staff. Values carry forward in document
     * order, so a repeat jumping back restores the signature written at its target measure.
     */
    static SmfTrack conductorTrack(Score score, int maxVisits, DebugSink dbg) {
        List<SmfEvent> events = new ArrayList<>();
        events.add(textMeta(META_TRACK_NAME, score.title(), 0));

        List<Measure> measures = score.parts().isEmpty() || score.parts().get(0).staves().isEmpty()
                ? List.of()
                : score.parts().get(0).staves().get(0).measures();

        Conductor current = new Conductor(DEFAULT_TEMPO_BPM, TimeSignature.COMMON, KeySignature.C_MAJOR);
        Map<String, Measure> byId = new HashMap<>();
        Map<String, Conductor> effective = new HashMap<>();
        for (Measure m : measures) {
            current = new Conductor(
                    m.tempoBpm() != null ? m.tempoBpm() : current.bpm(),
                    m.timeSignature() != null ? m.timeSignature() : current.time(),
                    m.keySignature() != null ? m.keySignature() : current.key());
            byId.putIfAbsent(m.id(), m);
            effective.putIfAbsent(m.id(), current);
        }

        Conductor emitted = null;
        long tick = 0;
        for (MeasureVisit visit : MeasureTraversal.resolve(measures, maxVisits).order()) {
            Conductor state = effective.get(visit.measureId());
            if (!state.equals(emitted)) {
                addConductorMetas(events, state, tick);
                dbg.log(String.format("[DEBUG] Conductor change at tick %d: %d bpm %s key %d%s",
                        tick, state.bpm(), state.time(), state.key().fifths(), state.key().minor() ? "m" : ""));
                emitted = state;
            }
            tick += PlaybackGenerator.measureTicks(byId.get(visit.measureId()));
        }
        if (emitted == null)
            addConductorMetas(events, new Conductor(DEFAULT_TEMPO_BPM, TimeSignature.COMMON, KeySignature.C_MAJOR), 0);

        events.add(endOfTrack(events.get(events.size() - 1).absoluteTick()));
        return new SmfTrack(events);
    }

    private static void addConductorMetas(List<SmfEvent> events, Conductor state, long tick) {
        events.add(tempoMeta(state.bpm(), tick));
        events.add(TimeSignatureInfo.of(state.time()).toMetaEvent(tick));
        events.add(keySignatureMeta(state.key(), tick));
    }

    // ─────────────────────────── part tracks ──────────────────────────────

    /**
     * A sounding note after tie merging: one note-on, one note-off.
     */
    static final class Region {
        final int pitch;
        long tick;
        long durationTicks;
        int velocity;

        Region(PlaybackEvent first) {
            this.pitch = first.pitch();
            this.tick = first.tick();
            this.durationTicks = first.durationTicks();
            this.velocity = first.velocity();
        }
    }

    private static List<List<PlaybackEvent>> routeToParts(Score score, ScoreIndex index, List<PlaybackEvent> events) {
        List<List<PlaybackEvent>> byPart = new ArrayList<>();
        for (int p = 0; p < score.parts().size(); p++)
            byPart.add(new ArrayList<>());
        for (PlaybackEvent event : events) {
            ScoreIndex.Entry entry = index.get(event.sourceEventId());
            if (entry == null || !(entry.event() instanceof NoteEvent))
                throw new IllegalArgumentException("playback event references unknown note " + event.sourceEventId());
            byPart.get(entry.partIndex()).add(event);
        }
        for (List<PlaybackEvent> list : byPart)
            list.sort(PlaybackEvent.TIMELINE_ORDER);
        return byPart;
    }

    /**
     * Collapses tie chains into single regions. A region stays open under the id of the note
     * its last member ties into; the next note with that id and pitch extends it.
     */
    static List<Region> mergeTies(List<PlaybackEvent> events, ScoreIndex index) {
        List<Region> regions = new ArrayList<>();
        Map<String, Region> open = new HashMap<>();
        for (PlaybackEvent event : events) {
            NoteEvent note = index.note(event.sourceEventId());
            Region region = open.remove(event.sourceEventId());
            if (region != null && region.pitch == event.pitch()) {
                region.durationTicks += event.durationTicks();
            } else {
                region = new Region(event);
                regions.add(region);
            }
            if (note != null && note.tieStartId() != null)
                open.put(note.tieStartId(), region);
        }
        return regions;
    }

    static void humanize(List<Region> regions, HumanizeConfig config, Random random) {
        for (Region r : regions) {
            int offset = jitter(random, config.maxTickOffset());
            int velocity = jitter(random, config.velocityJitter());
            r.tick = Math.max(0, r.tick + offset);
            r.velocity = Math.max(1, Math.min(127, r.velocity + velocity));
        }
    }

    private static int jitter(Random random, int max) {
        return max == 0 ? 0 : random.nextInt(2 * max + 1) - max;
    }

    private static SmfTrack partTrack(Part part, ChannelMapping mapping, List<Region> regions) {
        List<SmfEvent> events = new ArrayList<>();
        events.add(textMeta(META_TRACK_NAME, part.name(), 0));
        events.add(programChange(mapping.channel(), mapping.program(), 0));

        List<ChannelEvent> notes = new ArrayList<>();
        for (Region r : regions) {
            notes.add(noteOn(mapping.channel(), r.pitch, r.velocity, r.tick));
            notes.add(noteOff(mapping.channel(), r.pitch, r.tick + r.durationTicks));
        }
        // note-offs first at equal ticks; the sort is stable so region order survives otherwise
        notes.sort(Comparator.comparingLong(ChannelEvent::absoluteTick)
                .thenComparingInt(e -> e.isNoteOff() ? 0 : 1));
        events.addAll(notes);

        events.add(endOfTrack(events.get(events.size() - 1).absoluteTick()));
        return new SmfTrack(events);
    }
}
