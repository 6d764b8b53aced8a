package io.voidvortex.scoreplay.transport;

import io.voidvortex.scoreplay.playback.PlaybackEvent;

/**
 * Callbacks fired by scheduled transport work. Both default to doing nothing.
 */
public interface TransportListener {

    TransportListener NONE = new TransportListener() {
    };

    default void onEvent(PlaybackEvent event) {
    }

    /**
     * @param beat 1-based count-in beat
     */
    default void onMetronomeClick(int beat) {
    }
}
