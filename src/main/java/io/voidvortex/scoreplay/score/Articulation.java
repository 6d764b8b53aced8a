package io.voidvortex.scoreplay.score;

public enum Articulation {
    STACCATO,
    TENUTO,
    ACCENT
}
