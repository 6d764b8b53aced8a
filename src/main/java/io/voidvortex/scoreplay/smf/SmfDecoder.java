package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.DebugSink;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;
import static io.voidvortex.scoreplay.smf.SmfDecodeException.Reason.*;

/**
 * Parses Standard MIDI File bytes into an {@link SmfFile} and optionally prints a
 * human-readable trace. Well-formed content of any format is accepted; only structural damage
 * raises {@link SmfDecodeException}.
 */
public final class SmfDecoder {

    /* ─────────────── object state ───────────────────────────────────── */

    private final byte[] data;
    private final DebugSink dbg;

    /* parsing cursor */
    private int ptr;

    private SmfDecoder(byte[] data, DebugSink sink) {
        this.data = data;
        this.dbg = Objects.requireNonNullElse(sink, DebugSink.NOOP);
    }

    /* ───────────────── public façade ────────────────────────────────── */

    public static SmfFile decode(byte[] bytes) {
        return decode(bytes, DebugSink.NOOP);
    }

    public static SmfFile decode(byte[] bytes, DebugSink sink) {
        return new SmfDecoder(bytes, sink).parse();
    }

    private SmfFile parse() {
        SmfHeader header = parseHeader();
        dbg.log(String.format("[DEBUG] Header: format %d, %d tracks, division %d",
                header.format(), header.trackCount(), header.division()));

        List<SmfTrack> tracks = new ArrayList<>();
        for (int i = 0; i < header.trackCount(); i++)
            tracks.add(parseTrack(i));
        if (ptr < data.length)
            dbg.log("[DEBUG] Ignoring " + (data.length - ptr) + " trailing bytes after last track");
        return new SmfFile(header, tracks);
    }

    private SmfHeader parseHeader() {
        if (data.length < HEADER_CHUNK_SIZE || !chunkIdAt(0, HEADER_CHUNK_ID))
            throw new SmfDecodeException(HEADER_CHUNK_INVALID, "Missing MIDI header chunk.");
        if (u32(CHUNK_ID_LENGTH) != HEADER_LENGTH)
            throw new SmfDecodeException(HEADER_LENGTH_INVALID, "Unsupported MIDI header length.");
        int format = u16(CHUNK_PREFIX_LENGTH);
        int trackCount = u16(CHUNK_PREFIX_LENGTH + 2);
        int division = (short) u16(CHUNK_PREFIX_LENGTH + 4);
        ptr = HEADER_CHUNK_SIZE;
        return new SmfHeader(format, trackCount, division);
    }

    private SmfTrack parseTrack(int trackIndex) {
        if (ptr + CHUNK_PREFIX_LENGTH > data.length || !chunkIdAt(ptr, TRACK_CHUNK_ID))
            throw invalidTrack();
        long length = u32(ptr + CHUNK_ID_LENGTH);
        int start = ptr + CHUNK_PREFIX_LENGTH;
        if (start + length > data.length)
            throw invalidTrack();
        int end = start + (int) length;

        List<SmfEvent> events = new ArrayList<>();
        ptr = start;
        long tick = 0;
        int runningStatus = -1;
        while (ptr < end) {
            tick += readVarLen(end);
            if (ptr >= end)
                throw invalidTrack();
            int b = u8(data[ptr]);

            SmfEvent event;
            if (b == STATUS_META) {
                ptr++;
                int type = u8(data[need(1, end)]);
                if (type > 0x7F)
                    throw invalidTrack();
                ptr++;
                int len = (int) readVarLen(end);
                event = new MetaEvent(type, take(len, end), tick);
            } else if (b == STATUS_SYSEX || b == STATUS_SYSEX_ESCAPE) {
                ptr++;
                int len = (int) readVarLen(end);
                event = new SysexEvent(take(len, end), tick, b == STATUS_SYSEX_ESCAPE);
                runningStatus = -1;
            } else if (b >= 0x80 && b < STATUS_SYSEX) {
                ptr++;
                runningStatus = b;
                event = new ChannelEvent(b, take(ChannelEvent.dataLength(b), end), tick);
            } else if (b < 0x80) {
                if (runningStatus < 0)
                    throw invalidTrack();
                event = new ChannelEvent(runningStatus, take(ChannelEvent.dataLength(runningStatus), end), tick);
            } else {
                // system common / realtime bytes have no place in a file
                throw invalidTrack();
            }
            dbg.log(EventTrace.describe(trackIndex, event));
            events.add(event);
        }
        return new SmfTrack(events);
    }

    /* ───────── helpers ─────────────────────────────────────────────── */

    private long readVarLen(int end) {
        long value = 0;
        for (int i = 0; i < MAX_VARIABLE_LENGTH_BYTES; i++) {
            if (ptr >= end)
                throw invalidTrack();
            int b = u8(data[ptr++]);
            value = (value << 7) | (b & 0x7F);
            if ((b & 0x80) == 0)
                return value;
        }
        throw invalidTrack();
    }

    /**
     * Cursor position, after checking that {@code count} more bytes fit before the chunk end.
     */
    private int need(int count, int end) {
        if (ptr + count > end)
            throw invalidTrack();
        return ptr;
    }

    private byte[] take(int count, int end) {
        need(count, end);
        byte[] out = Arrays.copyOfRange(data, ptr, ptr + count);
        ptr += count;
        return out;
    }

    private boolean chunkIdAt(int offset, String id) {
        return id.equals(new String(data, offset, CHUNK_ID_LENGTH, StandardCharsets.US_ASCII));
    }

    private long u32(int offset) {
        return ((long) u8(data[offset]) << 24) | (u8(data[offset + 1]) << 16)
                | (u8(data[offset + 2]) << 8) | u8(data[offset + 3]);
    }

    private int u16(int offset) {
        return (u8(data[offset]) << 8) | u8(data[offset + 1]);
    }

    private static int u8(byte b) {
        return b & 0xFF;
    }

    private static SmfDecodeException invalidTrack() {
        return new SmfDecodeException(TRACK_CHUNK_INVALID, "Invalid MIDI track chunk.");
    }
}
