package io.voidvortex.scoreplay.smf;

/**
 * Parameters of the seeded timing and velocity perturbation applied at export.
 *
 * @param seed           seed of the pseudo-random sequence; same seed and input give identical bytes
 * @param maxTickOffset  onsets move by at most this many ticks either way
 * @param velocityJitter velocities move by at most this amount either way
 */
public record HumanizeConfig(long seed, int maxTickOffset, int velocityJitter) {

    public HumanizeConfig {
        if (maxTickOffset < 0)
            throw new IllegalArgumentException("maxTickOffset must not be negative");
        if (velocityJitter < 0)
            throw new IllegalArgumentException("velocityJitter must not be negative");
    }
}
