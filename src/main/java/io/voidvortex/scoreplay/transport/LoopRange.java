package io.voidvortex.scoreplay.transport;

/**
 * Half-open tick window {@code [startTick, endTick)}.
 */
public record LoopRange(long startTick, long endTick) {

    public LoopRange {
        if (startTick < 0 || endTick <= startTick)
            throw new IllegalArgumentException("invalid loop range [" + startTick + ", " + endTick + ")");
    }

    public boolean contains(long tick) {
        return tick >= startTick && tick < endTick;
    }
}
