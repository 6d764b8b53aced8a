package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.DebugSink;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Serializes an {@link SmfFile} into Standard MIDI File bytes. Every event carries its own
 * status byte; running status is never written. Sysex keeps the status byte it was decoded with.
 */
public final class SmfWriter {

    private final DebugSink dbg;

    public SmfWriter() {
        this(DebugSink.NOOP);
    }

    public SmfWriter(DebugSink sink) {
        this.dbg = Objects.requireNonNullElse(sink, DebugSink.NOOP);
    }

    public byte[] write(SmfFile file) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        SmfHeader header = file.header();
        out.writeBytes(HEADER_CHUNK_ID.getBytes(StandardCharsets.US_ASCII));
        writeU32(out, HEADER_LENGTH);
        writeU16(out, header.format());
        writeU16(out, file.tracks().size());
        writeU16(out, header.division());

        for (int i = 0; i < file.tracks().size(); i++) {
            byte[] content = trackContent(i, file.track(i));
            out.writeBytes(TRACK_CHUNK_ID.getBytes(StandardCharsets.US_ASCII));
            writeU32(out, content.length);
            out.writeBytes(content);
            dbg.log(String.format("[DEBUG] Track %d written, %d bytes", i, content.length));
        }
        return out.toByteArray();
    }

    private byte[] trackContent(int trackIndex, SmfTrack track) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        long last = 0;
        for (SmfEvent event : track.events()) {
            long tick = event.absoluteTick();
            if (tick < last)
                throw new IllegalArgumentException(String.format(
                        "track %d: event at tick %d follows tick %d", trackIndex, tick, last));
            writeVarLen(out, tick - last);
            last = tick;
            dbg.log(EventTrace.describe(trackIndex, event));

            if (event instanceof ChannelEvent ce) {
                out.write(ce.status());
                out.writeBytes(ce.data());
            } else if (event instanceof MetaEvent me) {
                out.write(STATUS_META);
                out.write(me.metaType());
                writeVarLen(out, me.length());
                out.writeBytes(me.payload());
            } else if (event instanceof SysexEvent se) {
                out.write(se.status());
                writeVarLen(out, se.length());
                out.writeBytes(se.payload());
            }
        }
        return out.toByteArray();
    }

    // ───────── helpers ─────────────────────────────────────────────────

    /**
     * Encodes {@code value} as a big-endian base-128 quantity, continuation bit set on every
     * byte but the last.
     */
    public static byte[] varLen(long value) {
        if (value < 0 || value > MAX_VARIABLE_LENGTH)
            throw new IllegalArgumentException("value " + value + " outside variable-length range");
        int size = 1;
        for (long v = value >> 7; v > 0; v >>= 7)
            size++;
        byte[] bytes = new byte[size];
        long v = value;
        for (int i = size - 1; i >= 0; i--) {
            bytes[i] = (byte) ((v & 0x7F) | (i == size - 1 ? 0 : 0x80));
            v >>= 7;
        }
        return bytes;
    }

    static void writeVarLen(ByteArrayOutputStream out, long value) {
        out.writeBytes(varLen(value));
    }

    private static void writeU32(ByteArrayOutputStream out, int value) {
        out.write(value >>> 24);
        out.write(value >>> 16);
        out.write(value >>> 8);
        out.write(value);
    }

    private static void writeU16(ByteArrayOutputStream out, int value) {
        out.write(value >>> 8);
        out.write(value);
    }
}
