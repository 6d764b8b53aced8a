package io.voidvortex.scoreplay.smf;

/**
 * Output channel (0-15) and General MIDI program (0-127) of one part.
 */
public record ChannelMapping(int channel, int program) {

    public ChannelMapping {
        if (channel < 0 || channel > 15)
            throw new IllegalArgumentException("channel " + channel + " outside 0-15");
        if (program < 0 || program > 127)
            throw new IllegalArgumentException("program " + program + " outside 0-127");
    }

    /**
     * Fallback for parts without an explicit mapping: channels are handed out by part order,
     * channel 9 is left to percussion parts.
     */
    public static ChannelMapping defaultFor(int partIndex, boolean percussion) {
        if (percussion)
            return new ChannelMapping(SmfConstants.PERCUSSION_CHANNEL, SmfConstants.DEFAULT_PROGRAM);
        int channel = partIndex % 15;
        if (channel >= SmfConstants.PERCUSSION_CHANNEL)
            channel++;
        return new ChannelMapping(channel, SmfConstants.DEFAULT_PROGRAM);
    }
}
