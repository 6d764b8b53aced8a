package io.voidvortex.scoreplay.transport;

public enum TransportState {
    STOPPED,
    PLAYING,
    PAUSED
}
