package io.voidvortex.scoreplay.playback;

import io.voidvortex.scoreplay.score.Measure;
import io.voidvortex.scoreplay.score.NoteEvent;
import io.voidvortex.scoreplay.score.Part;
import io.voidvortex.scoreplay.score.Score;
import io.voidvortex.scoreplay.score.Staff;
import io.voidvortex.scoreplay.score.Voice;
import io.voidvortex.scoreplay.score.VoiceEvent;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Id lookup over every voice event of a score, built once per generation or export call.
 * Ties and hairpins reference events by id and are resolved here instead of through
 * back-references in the model.
 */
public final class ScoreIndex {

    /**
     * @param documentIndex position in document order (part, staff, measure, voice, event)
     */
    public record Entry(VoiceEvent event, int partIndex, Part part, int documentIndex) {
    }

    private final Map<String, Entry> byId = new HashMap<>();
    private final List<VoiceEvent> documentOrder = new ArrayList<>();

    private ScoreIndex() {
    }

    public static ScoreIndex of(Score score) {
        ScoreIndex index = new ScoreIndex();
        List<Part> parts = score.parts();
        for (int p = 0; p < parts.size(); p++) {
            Part part = parts.get(p);
            for (Staff staff : part.staves())
                for (Measure measure : staff.measures())
                    for (Voice voice : measure.voices())
                        for (VoiceEvent event : voice.events())
                            index.add(event, p, part);
        }
        return index;
    }

    private void add(VoiceEvent event, int partIndex, Part part) {
        Entry entry = new Entry(event, partIndex, part, documentOrder.size());
        if (byId.putIfAbsent(event.id(), entry) != null)
            throw new IllegalArgumentException("duplicate event id " + event.id());
        documentOrder.add(event);
    }

    @Nullable
    public Entry get(String eventId) {
        return byId.get(eventId);
    }

    @Nullable
    public NoteEvent note(String eventId) {
        Entry entry = byId.get(eventId);
        return entry != null && entry.event() instanceof NoteEvent note ? note : null;
    }

    public List<VoiceEvent> documentOrder() {
        return Collections.unmodifiableList(documentOrder);
    }

    public int size() {
        return documentOrder.size();
    }
}
