package io.voidvortex.scoreplay.smf;

import io.voidvortex.scoreplay.score.Duration;
import io.voidvortex.scoreplay.score.Measure;
import io.voidvortex.scoreplay.score.Step;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.voidvortex.scoreplay.score.ScoreFixtures.*;

public class SmfImportTests {

    @Test
    public void testWarningsForFormatZeroAndSmpte() {
        byte[] raw = Bytes.of(
                0x4d, 0x54, 0x68, 0x64, 0, 0, 0, 6, 0, 0, 0, 1, 0x80, 0x20,
                0x4d, 0x54, 0x72, 0x6b, 0, 0, 0, 0x0b,
                0x00, 0x90, 60, 100,
                0x0a, 64, 120,
                0x00, 0xff, 0x2f, 0x00);
        ImportResult result = SmfImport.scaffold(raw);
        Assertions.assertTrue(result.warnings().contains("Only format 1 is fully supported."));
        Assertions.assertTrue(result.warnings().contains("SMPTE time division detected; ticks-per-quarter expected."));
        Assertions.assertEquals(1, result.file().tracks().size());

        // both notes are still sounding when the track ends
        Assertions.assertEquals(2, result.notes().size());
        Assertions.assertEquals(10, result.notes().get(0).durationTicks());
        Assertions.assertEquals(0, result.notes().get(1).durationTicks());
    }

    @Test
    public void testEncodedScoreImportsWithoutWarnings() {
        Measure m = Measure.builder("m1")
                .voice("v1",
                        note("a", Step.C, 4, Duration.QUARTER).tiedTo("b"),
                        note("b", Step.C, 4, Duration.QUARTER).tiedFrom("a"),
                        note("c", Step.G, 4, Duration.HALF))
                .build();
        ImportResult result = SmfImport.scaffold(SmfEncoder.encode(singleStaff("Import", m)));
        Assertions.assertFalse(result.hasWarnings());

        List<SmfImport.ImportedNote> notes = result.notes();
        Assertions.assertEquals(2, notes.size());
        Assertions.assertEquals(new SmfImport.ImportedNote(1, 0, 0, 960, 60, 84), notes.get(0));
        Assertions.assertEquals(new SmfImport.ImportedNote(1, 0, 960, 960, 67, 84), notes.get(1));
    }

    @Test
    public void testRepeatedPitchPairsFirstInFirstOut() {
        byte[] raw = Bytes.of(
                'M', 'T', 'h', 'd', 0, 0, 0, 6, 0, 1, 0, 1, 0x01, 0xE0,
                'M', 'T', 'r', 'k', 0, 0, 0, 20,
                0x00, 0x90, 60, 100,
                0x0a, 0x90, 60, 90,
                0x0a, 0x80, 60, 0,
                0x0a, 0x90, 60, 0,
                0x00, 0xFF, 0x2F, 0x00);
        List<SmfImport.ImportedNote> notes = SmfImport.scaffold(raw).notes();
        Assertions.assertEquals(2, notes.size());
        Assertions.assertEquals(20, notes.get(0).durationTicks());
        Assertions.assertEquals(100, notes.get(0).velocity());
        Assertions.assertEquals(20, notes.get(1).durationTicks());
        Assertions.assertEquals(10, notes.get(1).tick());
    }
}
