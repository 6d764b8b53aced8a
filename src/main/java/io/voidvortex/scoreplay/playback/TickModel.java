package io.voidvortex.scoreplay.playback;

import io.voidvortex.scoreplay.score.Duration;
import io.voidvortex.scoreplay.score.Tuplet;
import io.voidvortex.scoreplay.score.VoiceEvent;
import org.apache.commons.lang3.math.Fraction;

/**
 * Shared time base: every duration is expressed in ticks, 480 per quarter note, before it
 * reaches the generator, the transport or the codec.
 */
public final class TickModel {

    public static final int PPQ = 480;
    public static final int TICKS_PER_BEAT = PPQ;

    private static final Fraction ONE_DOT = Fraction.getFraction(3, 2);
    private static final Fraction TWO_DOTS = Fraction.getFraction(7, 4);

    private TickModel() {
    }

    public static int baseTicks(Duration duration) {
        return switch (duration) {
            case WHOLE -> PPQ * 4;
            case HALF -> PPQ * 2;
            case QUARTER -> PPQ;
            case EIGHTH -> PPQ / 2;
            case SIXTEENTH -> PPQ / 4;
            case THIRTY_SECOND -> PPQ / 8;
            case SIXTY_FOURTH -> PPQ / 16;
        };
    }

    public static int toTicks(Duration duration, int dots) {
        return toTicks(duration, dots, null);
    }

    /**
     * @param tuplet optional ratio; scales by {@code normal / actual}, rounded to the nearest tick
     */
    public static int toTicks(Duration duration, int dots, Tuplet tuplet) {
        Fraction ticks = Fraction.getFraction(baseTicks(duration), 1);
        if (dots == 1) ticks = ticks.multiplyBy(ONE_DOT);
        else if (dots == 2) ticks = ticks.multiplyBy(TWO_DOTS);
        if (tuplet != null)
            ticks = ticks.multiplyBy(Fraction.getFraction(tuplet.normal(), tuplet.actual()));
        return (int) Math.round(ticks.doubleValue());
    }

    public static int toTicks(VoiceEvent event) {
        return toTicks(event.duration(), event.dots(), event.tuplet());
    }
}
