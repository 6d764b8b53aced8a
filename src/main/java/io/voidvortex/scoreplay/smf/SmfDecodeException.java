package io.voidvortex.scoreplay.smf;

/**
 * Structural failure while reading a Standard MIDI File. No partial result accompanies it.
 */
public class SmfDecodeException extends RuntimeException {

    public enum Reason {
        HEADER_CHUNK_INVALID,
        HEADER_LENGTH_INVALID,
        TRACK_CHUNK_INVALID
    }

    private final Reason reason;

    public SmfDecodeException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
