package io.voidvortex.scoreplay;

import io.voidvortex.scoreplay.smf.ChannelEvent;
import io.voidvortex.scoreplay.smf.ImportResult;
import io.voidvortex.scoreplay.smf.MetaEvent;
import io.voidvortex.scoreplay.smf.MidiUtil;
import io.voidvortex.scoreplay.smf.SmfDecodeException;
import io.voidvortex.scoreplay.smf.SmfEvent;
import io.voidvortex.scoreplay.smf.SmfHeader;
import io.voidvortex.scoreplay.smf.SmfImport;
import io.voidvortex.scoreplay.smf.SmfTrack;
import io.voidvortex.scoreplay.smf.SysexEvent;

import javax.sound.midi.ShortMessage;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Entry-point utility that prints the structure of a Standard MIDI File.
 */
public final class SmfDump {

    private SmfDump() {
    }

    // ───────────────────────── public API ────────────────────────────────

    public static ImportResult dump(Path file, boolean debugFlag, PrintStream out) throws IOException {
        byte[] data = Files.readAllBytes(file);
        DebugSink sink = debugFlag ? out::println : DebugSink.NOOP;
        ImportResult result = SmfImport.scaffold(data, sink);

        SmfHeader header = result.file().header();
        out.printf("%s: format %d, %d tracks, division %d%n",
                file.getFileName(), header.format(), header.trackCount(), header.division());
        for (String warning : result.warnings())
            out.println("WARNING: " + warning);

        for (int i = 0; i < result.file().tracks().size(); i++) {
            SmfTrack track = result.file().track(i);
            out.printf("Track %d (%d events)%n", i, track.events().size());
            for (SmfEvent event : track.events())
                out.println("  " + format(event));
        }
        out.printf("%d notes%n", result.notes().size());
        return result;
    }

    static String format(SmfEvent event) {
        if (event instanceof ChannelEvent ce) {
            return switch (ce.command()) {
                case ShortMessage.NOTE_ON, ShortMessage.NOTE_OFF -> String.format("[t=%06d] ch%02d %-8s %-4s vel=%d",
                        ce.absoluteTick(), ce.channel(), ce.isNoteOn() ? "NOTE_ON" : "NOTE_OFF",
                        MidiUtil.noteName(ce.data1()), ce.data2());
                case ShortMessage.PROGRAM_CHANGE -> String.format("[t=%06d] ch%02d PROGRAM  %d",
                        ce.absoluteTick(), ce.channel(), ce.data1());
                default -> String.format("[t=%06d] ch%02d 0x%02X     %d %d",
                        ce.absoluteTick(), ce.channel(), ce.command(), ce.data1(), ce.data2());
            };
        }
        if (event instanceof MetaEvent me)
            return String.format("[t=%06d] META 0x%02X len=%d", me.absoluteTick(), me.metaType(), me.length());
        SysexEvent se = (SysexEvent) event;
        return String.format("[t=%06d] %s len=%d", se.absoluteTick(), se.escape() ? "SYSEX_ESC" : "SYSEX", se.length());
    }

    // ───────────────────────── CLI ─────────────────────────────────────────

    public static void main(String[] args) throws IOException {
        if (args.length == 0 || (args.length == 1 && Objects.equals(args[0], "--debug"))) {
            System.out.println("Usage: smfdump [--debug] <file.mid>");
            return;
        }
        boolean debug = Objects.equals(args[0], "--debug");
        Path file = Path.of(debug ? args[1] : args[0]);
        try {
            dump(file, debug, System.out);
        } catch (SmfDecodeException e) {
            System.err.println(file + ": " + e.getMessage() + " (" + e.getReason() + ")");
            System.exit(1);
        }
    }
}
