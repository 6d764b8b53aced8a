package io.voidvortex.scoreplay.playback;

import java.util.List;

/**
 * @param events    globally sorted playback events
 * @param traversal traversal of the staff with the longest visit order, for diagnostics
 */
public record GeneratorResult(List<PlaybackEvent> events, ResolverResult traversal) {

    public GeneratorResult {
        events = List.copyOf(events);
    }
}
