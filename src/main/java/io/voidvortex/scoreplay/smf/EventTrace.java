package io.voidvortex.scoreplay.smf;

import javax.sound.midi.ShortMessage;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Formatting of the per-event debug lines shared by writer and decoder.
 */
final class EventTrace {
    private EventTrace() {
    }

    /**
     * common header for every log line
     */
    static String hdr(long tick, int track, int firstByte) {
        return String.format("[t=%06d]  Trk%02d %s %-15s ",
                tick,
                track,
                String.format("0x%02X", firstByte),
                mnemonic(firstByte));
    }

    static String describe(int track, SmfEvent event) {
        if (event instanceof ChannelEvent ce) {
            String head = hdr(ce.absoluteTick(), track, ce.status());
            return switch (ce.command()) {
                case ShortMessage.NOTE_ON, ShortMessage.NOTE_OFF -> head + String.format("%s vel=%d ch=%d",
                        MidiUtil.noteName(ce.data1()), ce.data2(), ce.channel());
                case ShortMessage.PROGRAM_CHANGE -> head + String.format("pgm=%d ch=%d", ce.data1(), ce.channel());
                default -> head + String.format("d1=%d d2=%d ch=%d", ce.data1(), ce.data2(), ce.channel());
            };
        }
        if (event instanceof MetaEvent me) {
            String head = hdr(me.absoluteTick(), track, STATUS_META);
            return head + String.format("%-13s %s", metaMnemonic(me.metaType()), metaValue(me));
        }
        SysexEvent se = (SysexEvent) event;
        return hdr(se.absoluteTick(), track, se.status()) + "len=" + se.length();
    }

    /**
     * status byte → human mnemonic
     */
    static String mnemonic(int b) {
        return switch (b) {
            case STATUS_META -> "META";
            case STATUS_SYSEX -> "SYSEX";
            case STATUS_SYSEX_ESCAPE -> "SYSEX_ESC";
            default -> switch (b & MASK_COMMAND) {
                case ShortMessage.NOTE_OFF -> "NOTE_OFF";
                case ShortMessage.NOTE_ON -> "NOTE_ON";
                case ShortMessage.POLY_PRESSURE -> "POLY_PRESS";
                case ShortMessage.CONTROL_CHANGE -> "CONTROL_CHG";
                case ShortMessage.PROGRAM_CHANGE -> "PROGRAM_CHG";
                case ShortMessage.CHANNEL_PRESSURE -> "CHANNEL_AT";
                case ShortMessage.PITCH_BEND -> "PITCH_BEND";
                default -> "UNKNOWN";
            };
        };
    }

    static String metaMnemonic(int type) {
        return switch (type) {
            case META_TRACK_NAME -> "TRACK_NAME";
            case META_END_OF_TRACK -> "END_OF_TRACK";
            case META_TEMPO -> "TEMPO";
            case META_TIME_SIGNATURE -> "TIME_SIG";
            case META_KEY_SIGNATURE -> "KEY_SIG";
            default -> String.format("META_%02X", type);
        };
    }

    private static String metaValue(MetaEvent me) {
        byte[] p = me.payload();
        return switch (me.metaType()) {
            case META_TRACK_NAME -> '"' + me.text() + '"';
            case META_TEMPO -> p.length == 3 ? String.format("%.2f bpm", MidiUtil.bpm(p)) : "len=" + p.length;
            case META_TIME_SIGNATURE -> TimeSignatureInfo.fromMetaPayload(p).humanReadable;
            case META_KEY_SIGNATURE -> p.length == 2 ? String.format("fifths=%d %s", p[0], p[1] == 0 ? "major" : "minor") : "len=" + p.length;
            default -> "len=" + p.length;
        };
    }
}
