package io.voidvortex.scoreplay.smf;

import java.util.List;

public record SmfTrack(List<SmfEvent> events) {

    public SmfTrack {
        events = List.copyOf(events);
    }

    public List<ChannelEvent> channelEvents() {
        return events.stream()
                .filter(ChannelEvent.class::isInstance)
                .map(ChannelEvent.class::cast)
                .toList();
    }

    public List<ChannelEvent> channelEvents(int command) {
        return channelEvents().stream().filter(e -> e.command() == command).toList();
    }

    public List<MetaEvent> metaEvents(int metaType) {
        return events.stream()
                .filter(MetaEvent.class::isInstance)
                .map(MetaEvent.class::cast)
                .filter(e -> e.metaType() == metaType)
                .toList();
    }
}
