package io.voidvortex.scoreplay.smf;

/**
 * One event of a track, positioned at an absolute tick. Delta times only exist in the byte
 * stream.
 */
public sealed interface SmfEvent permits ChannelEvent, MetaEvent, SysexEvent {

    long absoluteTick();
}
