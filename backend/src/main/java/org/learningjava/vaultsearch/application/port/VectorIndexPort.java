package org.learningjava.vaultsearch.application.port;

import org.learningjava.vaultsearch.domain.model.EmbeddedChunk;
import org.learningjava.vaultsearch.domain.model.SearchResult;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage for notes and their embedded chunks. Chunk replacement must be atomic for concurrent readers.
 */
public interface VectorIndexPort {

    void ensureSchema();

    /** Stored content hash per vault-relative path. */
    Map<String, String> loadNoteHashes();

    Optional<String> findNoteHash(String filePath);

    /** Inserts or updates by path and returns the note id. */
    long upsertNote(String filePath, String title, String contentHash, Instant fileModifiedAt);

    /**
     * Deletes every chunk of the note and inserts the given ones, all or nothing.
     *
     * @return number of chunks that were replaced
     */
    int replaceChunksForNote(long noteId, List<EmbeddedChunk> chunks);

    /** Highest-scoring chunks first, each with score at or above {@code minScore}. */
    List<SearchResult> nearestNeighbors(float[] vector, int k, double minScore);

    /**
     * Removes notes with their chunks.
     *
     * @return number of chunks removed
     */
    int bulkDeleteNotes(Set<String> filePaths);

    /** Whether similarity search can run at all; false means "not set up yet", not a failure. */
    boolean isVectorSearchAvailable();

    long countNotes();

    long countChunks();
}
