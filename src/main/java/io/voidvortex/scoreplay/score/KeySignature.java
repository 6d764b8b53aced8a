package io.voidvortex.scoreplay.score;

/**
 * Key signature as a count of fifths (negative = flats) and a mode.
 */
public record KeySignature(int fifths, boolean minor) {

    public static final KeySignature C_MAJOR = new KeySignature(0, false);

    public KeySignature {
        if (fifths < -7 || fifths > 7)
            throw new IllegalArgumentException("fifths out of range: " + fifths);
    }
}
