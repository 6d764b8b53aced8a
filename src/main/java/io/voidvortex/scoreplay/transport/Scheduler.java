package io.voidvortex.scoreplay.transport;

/**
 * Minimal timing capability a host provides: a real timer, an audio clock or a virtual clock
 * in tests. The transport never owns a timer itself.
 *
 * @param <H> cancellable handle type returned by the host
 */
public interface Scheduler<H> {

    H schedule(long atTick, Runnable callback);

    void clear(H handle);
}
