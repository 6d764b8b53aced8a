package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.DebugSink;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Best-effort import on top of {@link SmfDecoder}. Content this code does not fully support
 * is reported as warnings instead of failing the parse.
 */
public final class SmfImport {

    public static final String WARNING_FORMAT = "Only format 1 is fully supported.";
    public static final String WARNING_SMPTE = "SMPTE time division detected; ticks-per-quarter expected.";

    private SmfImport() {
    }

    /**
     * A note-on paired with its note-off.
     */
    public record ImportedNote(int track, int channel, long tick, long durationTicks, int pitch, int velocity) {
    }

    public static ImportResult scaffold(byte[] bytes) {
        return scaffold(bytes, DebugSink.NOOP);
    }

    public static ImportResult scaffold(byte[] bytes, DebugSink sink) {
        SmfFile file = SmfDecoder.decode(bytes, sink);
        List<String> warnings = new ArrayList<>();
        if (file.header().format() != FORMAT_MULTI_TRACK)
            warnings.add(WARNING_FORMAT);
        if (file.header().isSmpte())
            warnings.add(WARNING_SMPTE);
        return new ImportResult(file, warnings, pairNotes(file));
    }

    /**
     * Pairs note-ons with note-offs of the same channel and pitch, first in first out. Notes
     * still sounding at the end of their track last until its final tick.
     */
    static List<ImportedNote> pairNotes(SmfFile file) {
        List<ImportedNote> notes = new ArrayList<>();
        for (int t = 0; t < file.tracks().size(); t++) {
            SmfTrack track = file.track(t);
            Map<Integer, Deque<ChannelEvent>> sounding = new HashMap<>();
            long lastTick = 0;
            for (SmfEvent event : track.events()) {
                lastTick = event.absoluteTick();
                if (!(event instanceof ChannelEvent ce))
                    continue;
                int key = ce.channel() << 7 | ce.data1();
                if (ce.isNoteOn()) {
                    sounding.computeIfAbsent(key, k -> new ArrayDeque<>()).addLast(ce);
                } else if (ce.isNoteOff()) {
                    Deque<ChannelEvent> open = sounding.get(key);
                    if (open != null && !open.isEmpty())
                        notes.add(toNote(t, open.removeFirst(), ce.absoluteTick()));
                }
            }
            for (Deque<ChannelEvent> open : sounding.values())
                for (ChannelEvent on : open)
                    notes.add(toNote(t, on, lastTick));
        }
        notes.sort(Comparator.comparingInt(ImportedNote::track)
                .thenComparingLong(ImportedNote::tick)
                .thenComparingInt(ImportedNote::pitch));
        return notes;
    }

    private static ImportedNote toNote(int track, ChannelEvent on, long offTick) {
        return new ImportedNote(track, on.channel(), on.absoluteTick(), offTick - on.absoluteTick(), on.data1(), on.data2());
    }
}
