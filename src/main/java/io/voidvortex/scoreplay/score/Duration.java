package io.voidvortex.scoreplay.score;

/**
 * Notated (undotted) duration values, longest first.
 */
public enum Duration {
    WHOLE,
    HALF,
    QUARTER,
    EIGHTH,
    SIXTEENTH,
    THIRTY_SECOND,
    SIXTY_FOURTH
}
