package io.voidvortex.scoreplay.smf;

import java.util.List;

/**
 * Parsed or to-be-written Standard MIDI File. Built fresh by every encode and decode call.
 */
public record SmfFile(SmfHeader header, List<SmfTrack> tracks) {

    public SmfFile {
        tracks = List.copyOf(tracks);
    }

    public SmfTrack track(int index) {
        return tracks.get(index);
    }
}
