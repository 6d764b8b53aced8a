package io.voidvortex.scoreplay.smf;

import javax.sound.midi.ShortMessage;
import java.util.Arrays;

import static io.voidvortex.scoreplay.smf.SmfConstants.*;

/**
 * Channel voice message: status byte (command | channel) plus one or two data bytes.
 */
public record ChannelEvent(int status, byte[] data, long absoluteTick) implements SmfEvent {

    public ChannelEvent {
        if (status < 0x80 || status >= STATUS_SYSEX)
            throw new IllegalArgumentException(String.format("not a channel status: 0x%02X", status));
        data = data.clone();
    }

    static ChannelEvent of(ShortMessage msg, long tick) {
        return new ChannelEvent(msg.getStatus(), Arrays.copyOfRange(msg.getMessage(), 1, msg.getLength()), tick);
    }

    /**
     * A copy; the event itself is not modified through it.
     */
    @Override
    public byte[] data() {
        return data.clone();
    }

    public int command() {
        return status & MASK_COMMAND;
    }

    public int channel() {
        return status & MASK_CHANNEL;
    }

    public int data1() {
        return data.length > 0 ? data[0] & 0x7F : 0;
    }

    public int data2() {
        return data.length > 1 ? data[1] & 0x7F : 0;
    }

    /**
     * Note-on with a non-zero velocity; a zero velocity note-on acts as note-off.
     */
    public boolean isNoteOn() {
        return command() == ShortMessage.NOTE_ON && data2() > 0;
    }

    public boolean isNoteOff() {
        return command() == ShortMessage.NOTE_OFF || (command() == ShortMessage.NOTE_ON && data2() == 0);
    }

    /**
     * Number of data bytes that follow a status byte of the given command.
     */
    static int dataLength(int status) {
        return switch (status & MASK_COMMAND) {
            case ShortMessage.PROGRAM_CHANGE, ShortMessage.CHANNEL_PRESSURE -> 1;
            default -> 2;
        };
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ChannelEvent other
                && status == other.status
                && absoluteTick == other.absoluteTick
                && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * status + Long.hashCode(absoluteTick)) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("ChannelEvent[t=%d status=0x%02X data=%s]", absoluteTick, status, Arrays.toString(data));
    }
}
