package io.voidvortex.scoreplay.score;

/**
 * Diatonic step of a pitch spelling with its chromatic offset above C.
 */
public enum Step {
    C(0), D(2), E(4), F(5), G(7), A(9), B(11);

    public final int chroma;

    Step(int chroma) {
        this.chroma = chroma;
    }
}
