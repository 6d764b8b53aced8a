package io.voidvortex.scoreplay.smf;

import javax.sound.midi.MetaMessage;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

public record MetaEvent(int metaType, byte[] payload, long absoluteTick) implements SmfEvent {

    public MetaEvent {
        if (metaType < 0 || metaType > 0x7F)
            throw new IllegalArgumentException(String.format("invalid meta type 0x%02X", metaType));
        payload = payload.clone();
    }

    static MetaEvent of(MetaMessage msg, long tick) {
        return new MetaEvent(msg.getType(), msg.getData(), tick);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int length() {
        return payload.length;
    }

    public String text() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetaEvent other
                && metaType == other.metaType
                && absoluteTick == other.absoluteTick
                && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * metaType + Long.hashCode(absoluteTick)) + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return String.format("MetaEvent[t=%d type=0x%02X payload=%s]", absoluteTick, metaType, Arrays.toString(payload));
    }
}
