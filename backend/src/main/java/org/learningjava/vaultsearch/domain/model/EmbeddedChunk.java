package org.learningjava.vaultsearch.domain.model;

public record EmbeddedChunk(NoteChunk chunk, float[] embedding) {

    public int chunkIndex() { return chunk.chunkIndex(); }

    public String text() { return chunk.text(); }
}
