package io.voidvortex.scoreplay.score;

/**
 * Slur between two events. Carried with the score; it does not shape playback.
 */
public record Slur(String id, String from, String to) {
}
