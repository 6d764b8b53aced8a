package io.voidvortex.scoreplay.score;

import java.util.Objects;

/**
 * Spelled pitch. {@code accidental} counts semitones, -2 (double flat) to 2 (double sharp).
 */
public record Pitch(Step step, int octave, int accidental) {

    public Pitch {
        Objects.requireNonNull(step, "step");
        if (accidental < -2 || accidental > 2)
            throw new IllegalArgumentException("accidental out of range: " + accidental);
    }

    public Pitch(Step step, int octave) {
        this(step, octave, 0);
    }

    /**
     * MIDI note number, middle C (C4) = 60. May fall outside 0-127 for extreme spellings.
     */
    public int midiNumber() {
        return (octave + 1) * 12 + step.chroma + accidental;
    }
}
