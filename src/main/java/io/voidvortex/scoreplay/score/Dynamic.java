package io.voidvortex.scoreplay.score;

/**
 * Dynamic markings with the velocity they map to in strict playback.
 */
public enum Dynamic {
    PPP(20),
    PP(36),
    P(52),
    MP(68),
    MF(84),
    F(102),
    FF(118),
    FFF(120);

    public final int velocity;

    Dynamic(int velocity) {
        this.velocity = velocity;
    }
}
