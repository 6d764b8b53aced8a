package io.voidvortex.scoreplay.score;

public enum Clef {
    TREBLE,
    BASS,
    ALTO,
    TENOR
}
