package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.score.KeySignature;

import javax.sound.midi.InvalidMidiDataException;
import javax.sound.midi.MetaMessage;
import javax.sound.midi.ShortMessage;
import java.nio.charset.StandardCharsets;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Utility helpers for building track events without cluttering the encoder. Messages go through
 * javax.sound.midi so channel and data ranges are validated in one place.
 */
public final class MidiUtil {
    private MidiUtil() {
    }

    public static ChannelEvent createShort(int command, int channel, int d1, int d2, long tick) {
        try {
            return ChannelEvent.of(new ShortMessage(command, channel, d1, d2), tick);
        } catch (InvalidMidiDataException e) {
            throw new IllegalArgumentException("Cannot build MIDI message", e);
        }
    }

    public static ChannelEvent programChange(int channel, int program, long tick) {
        return createShort(ShortMessage.PROGRAM_CHANGE, channel, program, 0, tick);
    }

    public static ChannelEvent noteOn(int channel, int pitch, int velocity, long tick) {
        return createShort(ShortMessage.NOTE_ON, channel, pitch, velocity, tick);
    }

    public static ChannelEvent noteOff(int channel, int pitch, long tick) {
        return createShort(ShortMessage.NOTE_OFF, channel, pitch, NOTE_OFF_VELOCITY, tick);
    }

    /**
     * @throws IllegalArgumentException when the tempo is too slow for the 24-bit field
     */
    public static MetaEvent tempoMeta(int bpm, long tick) {
        int mpqn = microsPerQuarter(bpm);
        if (mpqn > MAX_MICROS_PER_QUARTER)
            throw new IllegalArgumentException(String.format(
                    "%d bpm needs %d us per quarter, above the 0x%06X limit", bpm, mpqn, MAX_MICROS_PER_QUARTER));
        return meta(META_TEMPO, new byte[]{
                (byte) (mpqn >> 16),
                (byte) (mpqn >> 8),
                (byte) mpqn}, tick);
    }

    public static MetaEvent keySignatureMeta(KeySignature key, long tick) {
        return meta(META_KEY_SIGNATURE, new byte[]{(byte) key.fifths(), (byte) (key.minor() ? 1 : 0)}, tick);
    }

    public static MetaEvent textMeta(int type, String txt, long tick) {
        return meta(type, txt.getBytes(StandardCharsets.UTF_8), tick);
    }

    public static MetaEvent endOfTrack(long tick) {
        return meta(META_END_OF_TRACK, new byte[0], tick);
    }

    static MetaEvent meta(int type, byte[] data, long tick) {
        try {
            return MetaEvent.of(new MetaMessage(type, data, data.length), tick);
        } catch (InvalidMidiDataException e) {
            throw new IllegalStateException(e);
        }
    }

    public static int microsPerQuarter(int bpm) {
        return (int) (MICROS_PER_MINUTE / (bpm <= 0 ? DEFAULT_TEMPO_BPM : bpm));
    }

    /**
     * Decodes the 24-bit tempo payload back to beats per minute.
     */
    public static double bpm(byte[] tempoPayload) {
        int mpqn = ((tempoPayload[0] & 0xFF) << 16) | ((tempoPayload[1] & 0xFF) << 8) | (tempoPayload[2] & 0xFF);
        return mpqn == 0 ? 0 : (double) MICROS_PER_MINUTE / mpqn;
    }

    public static String noteName(int midiNote) {
        final String[] N = {"C", "C#", "D", "D#", "E", "F",
                "F#", "G", "G#", "A", "A#", "B"};
        if (midiNote < 0 || midiNote > 127) return "???";
        int octave = (midiNote / 12) - 1;          // scientific pitch, middle C = C4
        return N[midiNote % 12] + octave;
    }

}
