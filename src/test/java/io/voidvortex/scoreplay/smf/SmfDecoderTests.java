package io.voidvortex.scoreplay.smf;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

public class SmfDecoderTests {

    private static final int[] HEADER_ONE_TRACK = {'M', 'T', 'h', 'd', 0, 0, 0, 6, 0, 1, 0, 1, 0x01, 0xE0};

    private static byte[] oneTrack(int... content) {
        int[] all = new int[HEADER_ONE_TRACK.length + 8 + content.length];
        System.arraycopy(HEADER_ONE_TRACK, 0, all, 0, HEADER_ONE_TRACK.length);
        int i = HEADER_ONE_TRACK.length;
        all[i++] = 'M';
        all[i++] = 'T';
        all[i++] = 'r';
        all[i++] = 'k';
        all[i++] = content.length >>> 24;
        all[i++] = content.length >>> 16;
        all[i++] = content.length >>> 8;
        all[i++] = content.length;
        System.arraycopy(content, 0, all, i, content.length);
        return Bytes.of(all);
    }

    private static SmfDecodeException.Reason failure(byte[] bytes) {
        return Assertions.assertThrows(SmfDecodeException.class, () -> SmfDecoder.decode(bytes)).getReason();
    }

    @Test
    public void testRunningStatusAndSmpteDivision() {
        byte[] raw = Bytes.of(
                0x4d, 0x54, 0x68, 0x64, 0, 0, 0, 6, 0, 0, 0, 1, 0x80, 0x20,
                0x4d, 0x54, 0x72, 0x6b, 0, 0, 0, 0x0b,
                0x00, 0x90, 60, 100,
                0x0a, 64, 120,
                0x00, 0xff, 0x2f, 0x00);
        SmfFile file = SmfDecoder.decode(raw);
        Assertions.assertEquals(0, file.header().format());
        Assertions.assertTrue(file.header().isSmpte());

        List<ChannelEvent> channel = file.track(0).channelEvents();
        Assertions.assertEquals(2, channel.size());
        Assertions.assertEquals(0x90, channel.get(1).status());
        Assertions.assertEquals(64, channel.get(1).data1());
        Assertions.assertEquals(120, channel.get(1).data2());
        Assertions.assertEquals(10, channel.get(1).absoluteTick());
        Assertions.assertEquals(10, file.track(0).metaEvents(SmfConstants.META_END_OF_TRACK).get(0).absoluteTick());
    }

    @Test
    public void testInvalidHeaders() {
        Assertions.assertEquals(SmfDecodeException.Reason.HEADER_CHUNK_INVALID, failure(Bytes.of(1, 2, 3)));
        Assertions.assertEquals(SmfDecodeException.Reason.HEADER_CHUNK_INVALID,
                failure(Bytes.of('R', 'I', 'F', 'F', 0, 0, 0, 6, 0, 1, 0, 0, 1, 0xe0)));

        byte[] badHeaderLength = Bytes.of(0x4d, 0x54, 0x68, 0x64, 0, 0, 0, 7, 0, 1, 0, 0, 1, 0xe0);
        SmfDecodeException e = Assertions.assertThrows(SmfDecodeException.class, () -> SmfDecoder.decode(badHeaderLength));
        Assertions.assertEquals(SmfDecodeException.Reason.HEADER_LENGTH_INVALID, e.getReason());
        Assertions.assertEquals("Unsupported MIDI header length.", e.getMessage());
    }

    @Test
    public void testInvalidTrackChunk() {
        byte[] badTrackChunk = Bytes.of(
                0x4d, 0x54, 0x68, 0x64, 0, 0, 0, 6, 0, 1, 0, 1, 1, 0xe0,
                0, 0, 0, 0, 0, 0, 0, 0);
        SmfDecodeException e = Assertions.assertThrows(SmfDecodeException.class, () -> SmfDecoder.decode(badTrackChunk));
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, e.getReason());
        Assertions.assertEquals("Invalid MIDI track chunk.", e.getMessage());
    }

    @Test
    public void testTrackStructureViolations() {
        // fewer chunks than declared
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, failure(Bytes.of(HEADER_ONE_TRACK)));

        // declared length past the end of the buffer
        byte[] tooLong = oneTrack(0x00, 0xFF, 0x2F, 0x00);
        tooLong[21] = 9;
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, failure(tooLong));

        // event cut off by the chunk end
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, failure(oneTrack(0x00, 0x90, 60)));

        // delta time longer than four bytes
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID,
                failure(oneTrack(0x80, 0x80, 0x80, 0x80, 0x00, 0xFF, 0x2F, 0x00)));

        // data byte with no status to reuse
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, failure(oneTrack(0x00, 60, 100)));

        // system common byte
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, failure(oneTrack(0x00, 0xF2, 0x00, 0x00)));

        // meta payload longer than the chunk
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID, failure(oneTrack(0x00, 0xFF, 0x03, 0x05, 'a')));
    }

    @Test
    public void testSysex() {
        byte[] midi = Bytes.of(
                0x4d, 0x54, 0x68, 0x64, 0, 0, 0, 6, 0, 1, 0, 1, 1, 0xe0,
                0x4d, 0x54, 0x72, 0x6b, 0, 0, 0, 0x09,
                0x00, 0xf0, 0x02, 0x7d, 0x01,
                0x00, 0xff, 0x2f, 0x00);
        SmfEvent first = SmfDecoder.decode(midi).track(0).events().get(0);
        Assertions.assertInstanceOf(SysexEvent.class, first);
        Assertions.assertArrayEquals(Bytes.of(0x7d, 0x01), ((SysexEvent) first).payload());
        Assertions.assertFalse(((SysexEvent) first).escape());
    }

    @Test
    public void testDecodedEventsCannotBeModified() {
        SmfFile file = SmfDecoder.decode(oneTrack(
                0x00, 0x90, 60, 100,
                0x00, 0xf0, 0x01, 0x7d,
                0x00, 0xff, 0x03, 0x01, 'a',
                0x00, 0xff, 0x2f, 0x00));
        ChannelEvent noteOn = file.track(0).channelEvents(0x90).get(0);
        noteOn.data()[0] = 0;
        Assertions.assertEquals(60, file.track(0).channelEvents(0x90).get(0).data1());

        SysexEvent sysex = (SysexEvent) file.track(0).events().get(1);
        sysex.payload()[0] = 0;
        Assertions.assertArrayEquals(Bytes.of(0x7d), ((SysexEvent) file.track(0).events().get(1)).payload());

        MetaEvent name = file.track(0).metaEvents(SmfConstants.META_TRACK_NAME).get(0);
        name.payload()[0] = 'b';
        Assertions.assertEquals("a", file.track(0).metaEvents(SmfConstants.META_TRACK_NAME).get(0).text());
    }

    @Test
    public void testEventsCompareByContent() {
        byte[] track = oneTrack(0x00, 0x90, 60, 100, 0x00, 0xff, 0x2f, 0x00);
        SmfFile first = SmfDecoder.decode(track);
        SmfFile second = SmfDecoder.decode(track);
        Assertions.assertEquals(first.track(0).events(), second.track(0).events());
        Assertions.assertEquals(first.track(0).events().hashCode(), second.track(0).events().hashCode());
        Assertions.assertEquals(MidiUtil.noteOn(0, 60, 100, 0), first.track(0).channelEvents(0x90).get(0));
        Assertions.assertNotEquals(MidiUtil.noteOn(0, 61, 100, 0), first.track(0).channelEvents(0x90).get(0));
        Assertions.assertNotEquals(new SysexEvent(Bytes.of(1), 0, true), new SysexEvent(Bytes.of(1), 0, false));
    }

    @Test
    public void testSysexCancelsRunningStatus() {
        Assertions.assertEquals(SmfDecodeException.Reason.TRACK_CHUNK_INVALID,
                failure(oneTrack(0x00, 0x90, 60, 100, 0x00, 0xF0, 0x01, 0x7D, 0x00, 62, 100)));
    }

    @Test
    public void testMetaKeepsRunningStatus() {
        SmfFile file = SmfDecoder.decode(oneTrack(
                0x00, 0x91, 60, 100,
                0x00, 0xFF, 0x03, 0x01, 'x',
                0x10, 60, 0,
                0x00, 0xFF, 0x2F, 0x00));
        List<ChannelEvent> channel = file.track(0).channelEvents();
        Assertions.assertEquals(2, channel.size());
        Assertions.assertTrue(channel.get(1).isNoteOff());
        Assertions.assertEquals(1, channel.get(1).channel());
        Assertions.assertEquals(16, channel.get(1).absoluteTick());
        Assertions.assertEquals("x", file.track(0).metaEvents(SmfConstants.META_TRACK_NAME).get(0).text());
    }

    @Test
    public void testProgramChangeHasOneDataByte() {
        SmfFile file = SmfDecoder.decode(oneTrack(0x00, 0xC3, 40, 0x00, 0xFF, 0x2F, 0x00));
        ChannelEvent pc = file.track(0).channelEvents().get(0);
        Assertions.assertEquals(1, pc.data().length);
        Assertions.assertEquals(40, pc.data1());
        Assertions.assertEquals(3, pc.channel());
        Assertions.assertEquals(480, file.header().division());
    }

    @Test
    public void testTrailingBytesAreIgnoredAndTraced() {
        byte[] valid = oneTrack(0x00, 0xFF, 0x2F, 0x00);
        byte[] padded = new byte[valid.length + 3];
        System.arraycopy(valid, 0, padded, 0, valid.length);
        List<String> log = new ArrayList<>();
        SmfFile file = SmfDecoder.decode(padded, log::add);
        Assertions.assertEquals(1, file.tracks().size());
        Assertions.assertTrue(log.stream().anyMatch(line -> line.contains("trailing")));
        Assertions.assertTrue(log.stream().anyMatch(line -> line.contains("END_OF_TRACK")));
    }
}
