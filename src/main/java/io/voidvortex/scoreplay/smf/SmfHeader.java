package io.voidvortex.scoreplay.smf;

/**
 * @param division ticks per quarter note when positive, an SMPTE code when negative
 */
public record SmfHeader(int format, int trackCount, int division) {

    public boolean isSmpte() {
        return division < 0;
    }
}
