package io.voidvortex.scoreplay.score;

public record TimeSignature(int numerator, int denominator) {

    public static final TimeSignature COMMON = new TimeSignature(4, 4);
    public static final int MAX_NUMERATOR = 255;

    public TimeSignature {
        if (numerator <= 0 || numerator > MAX_NUMERATOR)
            throw new IllegalArgumentException("numerator must be in 1.." + MAX_NUMERATOR + ": " + numerator);
        if (denominator <= 0 || Integer.bitCount(denominator) != 1)
            throw new IllegalArgumentException("denominator must be a power of two: " + denominator);
    }

    @Override
    public String toString() {
        return numerator + "/" + denominator;
    }
}
