package io.voidvortex.scoreplay.playback;

import io.voidvortex.scoreplay.score.Articulation;
import io.voidvortex.scoreplay.score.NoteEvent;

/**
 * Per-note shaping derived from articulations in expressive playback. Several articulations on
 * one note compose: duration scales multiply, deltas add.
 */
public record ArticulationShape(double durationScale, int velocityDelta, int timingOffsetTicks) {

    public static final ArticulationShape NEUTRAL = new ArticulationShape(1.0, 0, 0);

    static final double STACCATO_SCALE = 0.55;
    static final double TENUTO_SCALE = 1.08;
    static final int TENUTO_ANTICIPATION = 2;
    static final int ACCENT_BOOST = 10;

    public static ArticulationShape of(NoteEvent note) {
        double scale = 1.0;
        int velocity = 0;
        int timing = 0;
        if (note.has(Articulation.STACCATO)) {
            scale *= STACCATO_SCALE;
        }
        if (note.has(Articulation.TENUTO)) {
            scale *= TENUTO_SCALE;
            timing -= TENUTO_ANTICIPATION;
        }
        if (note.has(Articulation.ACCENT)) {
            velocity += ACCENT_BOOST;
        }
        return new ArticulationShape(scale, velocity, timing);
    }

    public int shapeDuration(int ticks) {
        return Math.max(1, (int) Math.round(ticks * durationScale));
    }
}
