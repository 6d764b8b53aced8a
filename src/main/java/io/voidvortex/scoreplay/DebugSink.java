package io.voidvortex.scoreplay;

/**
 * Trace target of the traversal, transport and codec code. Library code only ever logs
 * through a sink; the CLI decides whether the lines reach stdout.
 */
@FunctionalInterface
public interface DebugSink {
    void log(String msg);

    DebugSink NOOP = msg -> { /* nothing */ };

    /**
     * Sink that tags every line with {@code prefix} before passing it on.
     */
    default DebugSink prefixed(String prefix) {
        return this == NOOP ? NOOP : msg -> log(prefix + msg);
    }
}
