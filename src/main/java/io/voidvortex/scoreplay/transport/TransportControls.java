package io.voidvortex.scoreplay.transport;

import org.jetbrains.annotations.Nullable;

public interface TransportControls {

    void play();

    void pause();

    void stop();

    /**
     * @param range window to restrict playback to, or null to play everything
     */
    void setLoop(@Nullable LoopRange range);

    void setCountInBeats(int beats);

    void setMetronomeEnabled(boolean enabled);

    TransportState getState();
}
