package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.score.KeySignature;
import io.voidvortex.scoreplay.score.TimeSignature;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class MidiUtilTests {

    @Test
    public void testTempoPayload() {
        MetaEvent tempo = MidiUtil.tempoMeta(120, 0);
        Assertions.assertEquals(SmfConstants.META_TEMPO, tempo.metaType());
        Assertions.assertArrayEquals(Bytes.of(0x07, 0xA1, 0x20), tempo.payload());
        Assertions.assertEquals(120.0, MidiUtil.bpm(tempo.payload()), 1e-9);
        Assertions.assertEquals(545454, MidiUtil.microsPerQuarter(110));
        Assertions.assertEquals(500000, MidiUtil.microsPerQuarter(0));
    }

    @Test
    public void testTempoBeyondThreeBytesIsRejected() {
        Assertions.assertArrayEquals(Bytes.of(0xE4, 0xE1, 0xC0), MidiUtil.tempoMeta(4, 0).payload());
        Assertions.assertThrows(IllegalArgumentException.class, () -> MidiUtil.tempoMeta(3, 0));
    }

    @Test
    public void testKeySignaturePayload() {
        Assertions.assertArrayEquals(Bytes.of(0xFD, 0x01), MidiUtil.keySignatureMeta(new KeySignature(-3, true), 0).payload());
        Assertions.assertArrayEquals(Bytes.of(0x02, 0x00), MidiUtil.keySignatureMeta(new KeySignature(2, false), 0).payload());
    }

    @Test
    public void testTimeSignaturePayload() {
        MetaEvent meta = TimeSignatureInfo.of(new TimeSignature(6, 8)).toMetaEvent(960);
        Assertions.assertArrayEquals(Bytes.of(6, 3, 24, 8), meta.payload());
        Assertions.assertEquals(960, meta.absoluteTick());
        TimeSignatureInfo back = TimeSignatureInfo.fromMetaPayload(meta.payload());
        Assertions.assertEquals("6/8", back.humanReadable);
        Assertions.assertEquals(8, back.denominator);
    }

    @Test
    public void testNumeratorBeyondOneByteIsRejected() {
        Assertions.assertArrayEquals(Bytes.of(0xFF, 2, 24, 8), TimeSignatureInfo.of(new TimeSignature(255, 4)).toMetaEvent(0).payload());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new TimeSignatureInfo("300/4", 300, 4).toMetaEvent(0));
    }

    @Test
    public void testChannelMessagesAreValidated() {
        ChannelEvent on = MidiUtil.noteOn(9, 36, 100, 0);
        Assertions.assertEquals(0x99, on.status());
        Assertions.assertTrue(on.isNoteOn());
        Assertions.assertTrue(MidiUtil.noteOff(0, 36, 10).isNoteOff());
        Assertions.assertThrows(IllegalArgumentException.class, () -> MidiUtil.noteOn(16, 60, 100, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> MidiUtil.programChange(0, 128, 0));
    }

    @Test
    public void testNoteNames() {
        Assertions.assertEquals("C4", MidiUtil.noteName(60));
        Assertions.assertEquals("A4", MidiUtil.noteName(69));
        Assertions.assertEquals("C-1", MidiUtil.noteName(0));
        Assertions.assertEquals("???", MidiUtil.noteName(128));
    }

    @Test
    public void testDefaultChannelsSkipPercussion() {
        Assertions.assertEquals(0, ChannelMapping.defaultFor(0, false).channel());
        Assertions.assertEquals(8, ChannelMapping.defaultFor(8, false).channel());
        Assertions.assertEquals(10, ChannelMapping.defaultFor(9, false).channel());
        Assertions.assertEquals(15, ChannelMapping.defaultFor(14, false).channel());
        Assertions.assertEquals(0, ChannelMapping.defaultFor(15, false).channel());
        Assertions.assertEquals(9, ChannelMapping.defaultFor(3, true).channel());
        Assertions.assertThrows(IllegalArgumentException.class, () -> new ChannelMapping(16, 0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new HumanizeConfig(1, -1, 0));
    }
}
