package io.voidvortex.scoreplay.score;

/**
 * Tuplet ratio: {@code actual} notes in the time of {@code normal}, e.g. 3:2 for triplets.
 */
public record Tuplet(int actual, int normal) {

    public static final Tuplet TRIPLET = new Tuplet(3, 2);

    public Tuplet {
        if (actual <= 0 || normal <= 0)
            throw new IllegalArgumentException("tuplet ratio must be positive: " + actual + ":" + normal);
    }
}
