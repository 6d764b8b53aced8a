package io.voidvortex.scoreplay.playback;

/**
 * One occurrence of a measure in linear performance order. {@code pass} grows with every
 * repeat or jump; it is diagnostic and never part of the measure's identity.
 */
public record MeasureVisit(String measureId, int pass) {
}
