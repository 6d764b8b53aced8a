package io.voidvortex.scoreplay.transport;

import io.voidvortex.scoreplay.DebugSink;
import io.voidvortex.scoreplay.playback.PlaybackEvent;
import io.voidvortex.scoreplay.playback.TickModel;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Transport controller over a host {@link Scheduler}. On {@link #play()} the whole schedule
 * (count-in clicks, then every event) is handed to the scheduler up front; the returned handles
 * are kept here and nowhere else, and are all cleared on {@link #pause()} and {@link #stop()}, so
 * nothing fires after a state change.
 * <p>
 * Intended for single-threaded use from the host's event loop. Position handling (seek, resume
 * offset) is up to the caller; pausing does not remember which events already fired.
 *
 * @param <H> handle type of the injected scheduler
 */
public final class SchedulerAdapter<H> implements TransportControls {

    private final Scheduler<H> scheduler;
    private final List<PlaybackEvent> events;
    private final TransportListener listener;
    private final DebugSink dbg;

    private final List<H> pending = new ArrayList<>();
    private TransportState state = TransportState.STOPPED;
    private LoopRange loop;
    private int countInBeats;
    private boolean metronome;

    public SchedulerAdapter(Scheduler<H> scheduler, List<PlaybackEvent> events, TransportListener listener) {
        this(scheduler, events, listener, DebugSink.NOOP);
    }

    public SchedulerAdapter(Scheduler<H> scheduler,
                            List<PlaybackEvent> events,
                            TransportListener listener,
                            DebugSink sink) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.events = List.copyOf(events);
        this.listener = Objects.requireNonNullElse(listener, TransportListener.NONE);
        this.dbg = Objects.requireNonNullElse(sink, DebugSink.NOOP).prefixed("[transport] ");
    }

    @Override
    public void play() {
        if (state == TransportState.PLAYING)
            return;
        state = TransportState.PLAYING;
        clearPending();
        scheduleAll();
        dbg.log("play, " + pending.size() + " callbacks scheduled");
    }

    @Override
    public void pause() {
        if (state != TransportState.PLAYING)
            return;
        state = TransportState.PAUSED;
        clearPending();
        dbg.log("pause");
    }

    @Override
    public void stop() {
        state = TransportState.STOPPED;
        clearPending();
        dbg.log("stop");
    }

    @Override
    public void setLoop(@Nullable LoopRange range) {
        this.loop = range;
    }

    @Override
    public void setCountInBeats(int beats) {
        this.countInBeats = Math.max(0, beats);
    }

    @Override
    public void setMetronomeEnabled(boolean enabled) {
        this.metronome = enabled;
    }

    @Override
    public TransportState getState() {
        return state;
    }

    /**
     * Number of scheduler handles currently held.
     */
    public int pendingCount() {
        return pending.size();
    }

    // ────────────────────────── inner helpers ────────────────────────────

    private void scheduleAll() {
        if (metronome) {
            for (int beat = 0; beat < countInBeats; beat++) {
                final int click = beat + 1;
                pending.add(scheduler.schedule((long) beat * TickModel.TICKS_PER_BEAT,
                        () -> listener.onMetronomeClick(click)));
            }
        }
        long offset = (long) countInBeats * TickModel.TICKS_PER_BEAT;
        for (PlaybackEvent event : events) {
            if (loop != null && !loop.contains(event.tick()))
                continue;
            pending.add(scheduler.schedule(offset + event.tick(), () -> listener.onEvent(event)));
        }
    }

    private void clearPending() {
        for (H handle : pending)
            scheduler.clear(handle);
        pending.clear();
    }
}
