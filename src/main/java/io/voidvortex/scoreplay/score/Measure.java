package io.voidvortex.scoreplay.score;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * One measure of a staff together with its repeat, volta and navigation flags. Optional
 * signature and tempo values apply from this measure on.
 */
public record Measure(String id,
                      int number,
                      List<Voice> voices,
                      @Nullable TimeSignature timeSignature,
                      @Nullable KeySignature keySignature,
                      @Nullable Integer tempoBpm,
                      boolean repeatStart,
                      boolean repeatEnd,
                      @Nullable Integer volta,
                      @Nullable NavigationMarker navigationMarker) {

    /**
     * Slowest tempo whose quarter note still fits a tempo meta event.
     */
    public static final int MIN_TEMPO_BPM = 4;

    public Measure {
        voices = List.copyOf(voices);
        if (volta != null && volta != 1 && volta != 2)
            throw new IllegalArgumentException("measure " + id + " has unsupported volta " + volta);
        if (tempoBpm != null && tempoBpm < MIN_TEMPO_BPM)
            throw new IllegalArgumentException("measure " + id + " has invalid tempo " + tempoBpm);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public boolean isVolta(int ending) {
        return volta != null && volta == ending;
    }

    public boolean hasMarker(NavigationMarker marker) {
        return navigationMarker == marker;
    }

    public static final class Builder {
        private final String id;
        private int number = 1;
        private final List<Voice> voices = new ArrayList<>();
        private TimeSignature timeSignature;
        private KeySignature keySignature;
        private Integer tempoBpm;
        private boolean repeatStart;
        private boolean repeatEnd;
        private Integer volta;
        private NavigationMarker navigationMarker;

        private Builder(String id) {
            this.id = id;
        }

        public Builder number(int number) {
            this.number = number;
            return this;
        }

        public Builder voice(Voice voice) {
            voices.add(voice);
            return this;
        }

        public Builder voice(String voiceId, VoiceEvent... events) {
            return voice(Voice.of(voiceId, events));
        }

        public Builder timeSignature(int numerator, int denominator) {
            this.timeSignature = new TimeSignature(numerator, denominator);
            return this;
        }

        public Builder keySignature(int fifths, boolean minor) {
            this.keySignature = new KeySignature(fifths, minor);
            return this;
        }

        public Builder tempo(int bpm) {
            this.tempoBpm = bpm;
            return this;
        }

        public Builder repeatStart() {
            this.repeatStart = true;
            return this;
        }

        public Builder repeatEnd() {
            this.repeatEnd = true;
            return this;
        }

        public Builder volta(int ending) {
            this.volta = ending;
            return this;
        }

        public Builder marker(NavigationMarker marker) {
            this.navigationMarker = marker;
            return this;
        }

        public Measure build() {
            return new Measure(id, number, voices, timeSignature, keySignature, tempoBpm,
                    repeatStart, repeatEnd, volta, navigationMarker);
        }
    }
}
