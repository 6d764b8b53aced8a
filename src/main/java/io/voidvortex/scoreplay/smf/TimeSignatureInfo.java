package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.score.TimeSignature;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Time signature together with its SMF meta encoding (numerator, log2 denominator, clocks per
 * click, 32nds per quarter).
 */
public class TimeSignatureInfo {
    public final String humanReadable;
    public final int numerator;
    public final int denominator;

    public TimeSignatureInfo(String humanReadable, int numerator, int denominator) {
        this.humanReadable = humanReadable;
        this.numerator = numerator;
        this.denominator = denominator;
    }

    public static TimeSignatureInfo of(TimeSignature signature) {
        return new TimeSignatureInfo(signature.toString(), signature.numerator(), signature.denominator());
    }

    /**
     * Reads the payload of a 0x58 meta event. Malformed payloads fall back to 4/4.
     */
    public static TimeSignatureInfo fromMetaPayload(byte[] payload) {
        if (payload.length < 2 || (payload[1] & 0xFF) > 6) {
            return new TimeSignatureInfo("unknown", 4, 4);
        }
        int numerator = payload[0] & 0xFF;
        int denominator = 1 << (payload[1] & 0xFF);
        return new TimeSignatureInfo(numerator + "/" + denominator, numerator, denominator);
    }

    public int denominatorPower() {
        int midiDenom = 0;
        int d = denominator;
        while (d > 1) {
            d >>= 1;
            midiDenom++;
        }
        return midiDenom;
    }

    public MetaEvent toMetaEvent(long tick) {
        if (numerator > MAX_TIME_SIGNATURE_NUMERATOR)
            throw new IllegalArgumentException("numerator does not fit one byte: " + numerator);
        byte[] data = new byte[]{
                (byte) numerator,
                (byte) denominatorPower(),
                (byte) MIDI_CLOCKS_PER_CLICK,      // MIDI clocks per metronome click (quarter note)
                (byte) THIRTY_SECONDS_PER_QUARTER  // 32nd notes per 24 MIDI clocks
        };
        return MidiUtil.meta(META_TIME_SIGNATURE, data, tick);
    }

    @Override
    public String toString() {
        return humanReadable;
    }
}
