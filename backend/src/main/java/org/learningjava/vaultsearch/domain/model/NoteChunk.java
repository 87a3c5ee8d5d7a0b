package org.learningjava.vaultsearch.domain.model;

/**
 * One bounded span of a note, before embedding. Line numbers are zero-based and inclusive.
 */
public record NoteChunk(
        int chunkIndex,
        String text,
        int startLine,
        int endLine
) {
    public NoteChunk {
        if (startLine > endLine) {
            throw new IllegalArgumentException("startLine " + startLine + " > endLine " + endLine);
        }
    }
}
