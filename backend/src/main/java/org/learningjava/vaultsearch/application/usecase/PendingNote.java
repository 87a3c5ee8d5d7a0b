package org.learningjava.vaultsearch.application.usecase;

import org.learningjava.vaultsearch.domain.model.EmbeddedChunk;
import org.learningjava.vaultsearch.domain.model.NoteChunk;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A changed note waiting for its chunk vectors. Chunks and vectors are released once the note is
 * persisted or skipped, so a run only holds the notes whose batches are still in flight.
 */
final class PendingNote {
    final String path;
    final String title;
    final String hash;
    final Instant modifiedAt;
    final boolean isNew;
    final int chunkCount;
    private List<NoteChunk> chunks;
    private float[][] vectors;
    private int embeddedCount;
    boolean failed;

    PendingNote(String path, String title, String hash, Instant modifiedAt, boolean isNew, List<NoteChunk> chunks) {
        this.path = path;
        this.title = title;
        this.hash = hash;
        this.modifiedAt = modifiedAt;
        this.isNew = isNew;
        this.chunks = chunks;
        this.chunkCount = chunks.size();
        this.vectors = new float[chunkCount][];
    }

    String chunkText(int i) {
        return live().get(i).text();
    }

    void accept(int i, float[] vector) {
        live();
        vectors[i] = vector;
        embeddedCount++;
    }

    boolean isComplete() {
        return embeddedCount == chunkCount;
    }

    List<EmbeddedChunk> embeddedChunks() {
        List<NoteChunk> cs = live();
        List<EmbeddedChunk> out = new ArrayList<>(cs.size());
        for (int i = 0; i < cs.size(); i++) out.add(new EmbeddedChunk(cs.get(i), vectors[i]));
        return out;
    }

    void release() {
        chunks = null;
        vectors = null;
    }

    boolean isReleased() {
        return chunks == null;
    }

    private List<NoteChunk> live() {
        if (chunks == null) throw new IllegalStateException("Note " + path + " was already released");
        return chunks;
    }
}
