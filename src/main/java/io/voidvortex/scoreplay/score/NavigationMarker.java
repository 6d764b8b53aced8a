package io.voidvortex.scoreplay.score;

/**
 * Navigation markup attached to a measure. {@link #DS} marks both the sign and the
 * "dal segno" instruction; {@link #CODA} is carried but does not redirect playback.
 */
public enum NavigationMarker {
    DC,
    DS,
    FINE,
    CODA
}
