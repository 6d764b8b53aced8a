package io.voidvortex.scoreplay.transport;

import io.voidvortex.scoreplay.playback.PlaybackEvent;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class SchedulerAdapterTests {
    VirtualScheduler scheduler;
    List<String> fired;
    SchedulerAdapter<VirtualScheduler.Handle> transport;

    private static PlaybackEvent event(String id, long tick) {
        return new PlaybackEvent(id, tick, 480, 60, 84, List.of());
    }

    @BeforeEach
    public void setUp() {
        scheduler = new VirtualScheduler();
        fired = new ArrayList<>();
        List<PlaybackEvent> events = List.of(event("a", 0), event("b", 480), event("c", 960));
        transport = new SchedulerAdapter<>(scheduler, events, new TransportListener() {
            @Override
            public void onEvent(PlaybackEvent event) {
                fired.add(event.sourceEventId());
            }

            @Override
            public void onMetronomeClick(int beat) {
                fired.add("click" + beat);
            }
        });
    }

    @Test
    public void testStateTransitions() {
        Assertions.assertEquals(TransportState.STOPPED, transport.getState());
        transport.pause();
        Assertions.assertEquals(TransportState.STOPPED, transport.getState());
        transport.play();
        Assertions.assertEquals(TransportState.PLAYING, transport.getState());
        transport.pause();
        Assertions.assertEquals(TransportState.PAUSED, transport.getState());
        transport.play();
        Assertions.assertEquals(TransportState.PLAYING, transport.getState());
        transport.stop();
        Assertions.assertEquals(TransportState.STOPPED, transport.getState());
        transport.stop();
        Assertions.assertEquals(TransportState.STOPPED, transport.getState());
    }

    @Test
    public void testPlayWhilePlayingDoesNotScheduleTwice() {
        transport.play();
        transport.play();
        Assertions.assertEquals(3, scheduler.size());
        Assertions.assertEquals(3, transport.pendingCount());
    }

    @Test
    public void testCountInWithMetronomeAndLoop() {
        transport.setCountInBeats(2);
        transport.setMetronomeEnabled(true);
        transport.setLoop(new LoopRange(0, 481));
        transport.play();
        Assertions.assertEquals(List.of(0L, 480L, 960L, 1440L), scheduler.queuedTicks());

        scheduler.advanceTo(2000);
        Assertions.assertEquals(List.of("click1", "click2", "a", "b"), fired);
    }

    @Test
    public void testCountInWithoutMetronomeOnlyDelays() {
        transport.setCountInBeats(1);
        transport.play();
        Assertions.assertEquals(List.of(480L, 960L, 1440L), scheduler.queuedTicks());
    }

    @Test
    public void testNegativeCountInIsClamped() {
        transport.setCountInBeats(-3);
        transport.setMetronomeEnabled(true);
        transport.play();
        Assertions.assertEquals(List.of(0L, 480L, 960L), scheduler.queuedTicks());
    }

    @Test
    public void testNothingFiresAfterPauseOrStop() {
        transport.play();
        scheduler.advanceTo(500);
        Assertions.assertEquals(List.of("a", "b"), fired);

        transport.pause();
        Assertions.assertEquals(0, scheduler.size());
        Assertions.assertEquals(0, transport.pendingCount());
        scheduler.advanceTo(5000);
        Assertions.assertEquals(List.of("a", "b"), fired);

        transport.play();
        Assertions.assertEquals(3, transport.pendingCount());
        transport.stop();
        scheduler.advanceTo(10000);
        Assertions.assertEquals(List.of("a", "b"), fired);
    }

    @Test
    public void testLoopRangeIsHalfOpen() {
        LoopRange range = new LoopRange(480, 960);
        Assertions.assertTrue(range.contains(480));
        Assertions.assertFalse(range.contains(960));
        transport.setLoop(range);
        transport.play();
        Assertions.assertEquals(List.of(480L), scheduler.queuedTicks());
    }

    @Test
    public void testTraceLinesAreTagged() {
        List<String> log = new ArrayList<>();
        SchedulerAdapter<VirtualScheduler.Handle> traced =
                new SchedulerAdapter<>(scheduler, List.of(event("a", 0)), TransportListener.NONE, log::add);
        traced.play();
        traced.stop();
        Assertions.assertEquals(List.of("[transport] play, 1 callbacks scheduled", "[transport] stop"), log);
    }
}
