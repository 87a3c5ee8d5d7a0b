package org.learningjava.vaultsearch.domain.model;

import java.time.Duration;
import java.util.List;

/**
 * Summary of one indexing invocation. Per-file failures end up in {@code errors}; they never abort the run.
 */
public record IndexingResult(
        int notesScanned,
        int notesAdded,
        int notesUpdated,
        int notesUnchanged,
        int notesRemoved,
        int chunksCreated,
        int chunksRemoved,
        Duration duration,
        List<String> errors
) {
    public IndexingResult {
        errors = List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
