package io.voidvortex.scoreplay.smf;

import java.util.List;

/**
 * Decoded file plus advisory warnings and the notes paired from its channel events.
 */
public record ImportResult(SmfFile file, List<String> warnings, List<SmfImport.ImportedNote> notes) {

    public ImportResult {
        warnings = List.copyOf(warnings);
        notes = List.copyOf(notes);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
