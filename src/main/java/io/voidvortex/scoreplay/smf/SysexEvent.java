package io.voidvortex.scoreplay.smf;

import java.util.Arrays;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * System exclusive message. {@code escape} marks the 0xF7 form, which the writer puts back
 * as 0xF7; plain sysex is written as 0xF0.
 */
public record SysexEvent(byte[] payload, long absoluteTick, boolean escape) implements SmfEvent {

    public SysexEvent {
        payload = payload.clone();
    }

    public SysexEvent(byte[] payload, long absoluteTick) {
        this(payload, absoluteTick, false);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    public int status() {
        return escape ? STATUS_SYSEX_ESCAPE : STATUS_SYSEX;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof SysexEvent other
                && absoluteTick == other.absoluteTick
                && escape == other.escape
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Long.hashCode(absoluteTick) + Boolean.hashCode(escape)) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "SysexEvent[t=" + absoluteTick + " status=" + String.format("0x%02X", status())
                + " payload=" + Arrays.toString(payload) + "]";
    }
}
