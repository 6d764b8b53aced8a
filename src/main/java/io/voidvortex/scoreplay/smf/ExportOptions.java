package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.DebugSink;
import io.voidvortex.scoreplay.playback.MeasureTraversal;
import io.voidvortex.scoreplay.playback.PlaybackEvent;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-call export configuration.
 *
 * @param usePlaybackEvents   events to write verbatim; null regenerates them in strict mode
 * @param partChannelMapping  channel/program per part id; missing parts use {@link ChannelMapping#defaultFor}
 * @param humanize            null disables humanization
 * @param maxVisits           traversal bound used when events are generated
 * @param sink                trace of every written event
 */
public record ExportOptions(@Nullable List<PlaybackEvent> usePlaybackEvents,
                            Map<String, ChannelMapping> partChannelMapping,
                            @Nullable HumanizeConfig humanize,
                            int maxVisits,
                            DebugSink sink) {

    public ExportOptions {
        usePlaybackEvents = usePlaybackEvents != null ? List.copyOf(usePlaybackEvents) : null;
        partChannelMapping = Map.copyOf(partChannelMapping);
        if (maxVisits < 1)
            throw new IllegalArgumentException("maxVisits must be positive");
        sink = Objects.requireNonNullElse(sink, DebugSink.NOOP);
    }

    public static ExportOptions defaults() {
        return new ExportOptions(null, Map.of(), null, MeasureTraversal.DEFAULT_MAX_VISITS, DebugSink.NOOP);
    }

    public ExportOptions withPlaybackEvents(List<PlaybackEvent> events) {
        return new ExportOptions(events, partChannelMapping, humanize, maxVisits, sink);
    }

    public ExportOptions withChannelMapping(String partId, ChannelMapping mapping) {
        Map<String, ChannelMapping> copy = new HashMap<>(partChannelMapping);
        copy.put(partId, mapping);
        return new ExportOptions(usePlaybackEvents, copy, humanize, maxVisits, sink);
    }

    public ExportOptions withHumanize(@Nullable HumanizeConfig config) {
        return new ExportOptions(usePlaybackEvents, partChannelMapping, config, maxVisits, sink);
    }

    public ExportOptions withMaxVisits(int visits) {
        return new ExportOptions(usePlaybackEvents, partChannelMapping, humanize, visits, sink);
    }

    public ExportOptions withSink(DebugSink debugSink) {
        return new ExportOptions(usePlaybackEvents, partChannelMapping, humanize, maxVisits, debugSink);
    }
}
