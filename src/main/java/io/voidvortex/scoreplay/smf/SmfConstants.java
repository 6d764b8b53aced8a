package io.voidvortex.scoreplay.smf;

/**
 * Central location for every chunk id, status byte, meta type and default that appears in the
 * Standard MIDI File layout written and read here. Everything else refers to these names
 * instead of repeating the numbers.
 */
public final class SmfConstants {
    private SmfConstants() {
    }

    // ─────────────────────────── chunks ────────────────────────────────
    public static final String HEADER_CHUNK_ID = "MThd";
    public static final String TRACK_CHUNK_ID = "MTrk";
    public static final int CHUNK_ID_LENGTH = 4;
    public static final int CHUNK_PREFIX_LENGTH = 8;          // id + uint32 length
    public static final int HEADER_LENGTH = 6;                // format, track count, division
    public static final int HEADER_CHUNK_SIZE = CHUNK_PREFIX_LENGTH + HEADER_LENGTH;

    public static final int FORMAT_SINGLE_TRACK = 0;
    public static final int FORMAT_MULTI_TRACK = 1;
    public static final int FORMAT_MULTI_SONG = 2;

    // ───────────────────────── status bytes ────────────────────────────
    public static final int STATUS_META = 0xFF;
    public static final int STATUS_SYSEX = 0xF0;
    public static final int STATUS_SYSEX_ESCAPE = 0xF7;
    public static final int MASK_COMMAND = 0xF0;
    public static final int MASK_CHANNEL = 0x0F;

    // ────────────────────────── meta types ─────────────────────────────
    public static final int META_TRACK_NAME = 0x03;
    public static final int META_END_OF_TRACK = 0x2F;
    public static final int META_TEMPO = 0x51;
    public static final int META_TIME_SIGNATURE = 0x58;
    public static final int META_KEY_SIGNATURE = 0x59;

    // ─────────────────────── variable length ───────────────────────────
    /**
     * Largest value a four byte variable-length quantity can hold.
     */
    public static final long MAX_VARIABLE_LENGTH = 0x0FFF_FFFFL;
    public static final int MAX_VARIABLE_LENGTH_BYTES = 4;
    /**
     * Tempo metas hold microseconds per quarter in three bytes.
     */
    public static final int MAX_MICROS_PER_QUARTER = 0xFF_FFFF;
    public static final int MAX_TIME_SIGNATURE_NUMERATOR = 0xFF;

    // ──────────────────────────── defaults ─────────────────────────────
    public static final int PERCUSSION_CHANNEL = 9;
    public static final int DEFAULT_TEMPO_BPM = 120;
    public static final int DEFAULT_PROGRAM = 0;
    public static final int NOTE_OFF_VELOCITY = 0;
    public static final int MIDI_CLOCKS_PER_CLICK = 24;
    public static final int THIRTY_SECONDS_PER_QUARTER = 8;
    public static final long MICROS_PER_MINUTE = 60_000_000L;
}
