package io.voidvortex.scoreplay.playback;

/**
 * Why a traversal stopped. Only {@link #SAFETY_LIMIT} signals a malformed repeat graph.
 */
public enum Termination {
    END_OF_SCORE,
    FINE,
    SAFETY_LIMIT
}
