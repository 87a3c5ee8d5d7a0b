package org.learningjava.vaultsearch.application.usecase;

import org.learningjava.vaultsearch.application.port.EmbeddingConfigurationException;
import org.learningjava.vaultsearch.application.port.EmbeddingException;
import org.learningjava.vaultsearch.application.port.EmbeddingPort;
import org.learningjava.vaultsearch.application.port.VaultReaderPort;
import org.learningjava.vaultsearch.application.port.VectorIndexPort;
import org.learningjava.vaultsearch.config.VaultProperties;
import org.learningjava.vaultsearch.domain.model.IndexingResult;
import org.learningjava.vaultsearch.domain.model.NoteChunk;
import org.learningjava.vaultsearch.domain.model.NoteFile;
import org.learningjava.vaultsearch.domain.service.ContentHasher;
import org.learningjava.vaultsearch.domain.service.chunking.NoteChunker;
import org.learningjava.vaultsearch.domain.service.chunking.NoteTitles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the vector index in line with the markdown files of the vault.
 * <p>
 * A run hashes every matching file and compares with the stored hash: unchanged notes are skipped, new and
 * modified ones are chunked and embedded, and notes whose file disappeared are deleted. Chunks of all pending
 * notes are embedded together in provider-sized batches, one batch at a time. A note is persisted, with
 * a wholesale chunk replace, as soon as its last chunk has a vector.
 * <p>
 * Failures of single files or batches are collected in the result; only a missing vault root or missing
 * embedding configuration abort a run. Runs, single-note indexing and removals are serialized by one lock.
 */
@Service
public class VaultIndexer {

    private static final Logger log = LoggerFactory.getLogger(VaultIndexer.class);

    private final VaultReaderPort reader;
    private final VectorIndexPort index;
    private final EmbeddingPort embedding;
    private final NoteChunker chunker;
    private final VaultProperties props;
    private final ReentrantLock runLock = new ReentrantLock();

    public VaultIndexer(VaultReaderPort reader,
                        VectorIndexPort index,
                        EmbeddingPort embedding,
                        NoteChunker chunker,
                        VaultProperties props) {
        this.reader = reader;
        this.index = index;
        this.embedding = embedding;
        this.chunker = chunker;
        this.props = props;
    }

    public IndexingResult indexVault() {
        Path root = vaultRoot();
        lockRun();
        try {
            return runFullIndex(root);
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Reindexes one file, given relative to the vault root or as an absolute path inside it.
     * Unchanged content is skipped; a missing or unreadable file is reported as an error.
     */
    public IndexingResult indexNote(String path) {
        Path root = vaultRoot();
        String rel = toVaultPath(root, path);
        lockRun();
        try {
            long t0 = System.nanoTime();
            Tally t = new Tally();
            t.scanned = 1;
            try {
                NoteFile file = reader.read(root, rel);
                String hash = ContentHasher.sha256(file.content());
                Optional<String> stored = index.findNoteHash(rel);
                if (stored.isPresent() && stored.get().equals(hash)) {
                    t.unchanged++;
                } else {
                    PendingNote p = prepare(file, hash, stored.isEmpty());
                    embedAndPersist(List.of(p), embedding.maxBatchSize(), t);
                }
            } catch (CancellationException | EmbeddingConfigurationException e) {
                throw e;
            } catch (Exception e) {
                t.error(rel, e);
            }
            IndexingResult result = t.toResult(t0);
            log.info("Indexed note {}: added={} updated={} unchanged={} errors={}",
                    rel, result.notesAdded(), result.notesUpdated(), result.notesUnchanged(), result.errors().size());
            return result;
        } finally {
            runLock.unlock();
        }
    }

    public IndexingResult removeNote(String path) {
        Path root = vaultRoot();
        String rel = toVaultPath(root, path);
        lockRun();
        try {
            long t0 = System.nanoTime();
            Tally t = new Tally();
            if (index.findNoteHash(rel).isPresent()) {
                t.chunksRemoved = index.bulkDeleteNotes(Set.of(rel));
                t.removed = 1;
                log.info("Removed note {} ({} chunks)", rel, t.chunksRemoved);
            } else {
                log.debug("Remove requested for unknown note {}", rel);
            }
            return t.toResult(t0);
        } finally {
            runLock.unlock();
        }
    }

    // ---------- run ----------

    private IndexingResult runFullIndex(Path root) {
        long t0 = System.nanoTime();
        log.info("Indexing vault {}", root);
        Tally t = new Tally();

        List<String> paths;
        try {
            paths = reader.listNotes(root, props.getInclude(), props.getExclude());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to scan vault " + root, e);
        }
        t.scanned = paths.size();

        Map<String, String> stored = index.loadNoteHashes();
        List<PendingNote> pending = new ArrayList<>();
        for (String rel : paths) {
            checkCancelled();
            try {
                NoteFile file = reader.read(root, rel);
                String hash = ContentHasher.sha256(file.content());
                String previous = stored.get(rel);
                if (hash.equals(previous)) {
                    t.unchanged++;
                    continue;
                }
                pending.add(prepare(file, hash, previous == null));
            } catch (CancellationException e) {
                throw e;
            } catch (Exception e) {
                t.error(rel, e);
            }
        }
        log.debug("{} notes to (re)index, {} unchanged", pending.size(), t.unchanged);

        embedAndPersist(pending, batchSize(), t);

        Set<String> deletions = new HashSet<>(stored.keySet());
        deletions.removeAll(paths);
        if (!deletions.isEmpty()) {
            checkCancelled();
            try {
                t.chunksRemoved += index.bulkDeleteNotes(deletions);
                t.removed = deletions.size();
            } catch (RuntimeException e) {
                log.warn("Failed to delete {} vanished notes: {}", deletions.size(), e.getMessage());
                t.errors.add("delete " + deletions.size() + " notes: " + e.getMessage());
            }
        }

        IndexingResult result = t.toResult(t0);
        log.info("✅ Vault indexed in {} ms: scanned={} added={} updated={} removed={} chunks={} errors={}",
                result.duration().toMillis(), result.notesScanned(), result.notesAdded(), result.notesUpdated(),
                result.notesRemoved(), result.chunksCreated(), result.errors().size());
        return result;
    }

    private PendingNote prepare(NoteFile file, String hash, boolean isNew) {
        String title = NoteTitles.resolve(file.content(), file.relativePath());
        List<NoteChunk> chunks = chunker.chunk(file.content(), file.relativePath(), title);
        return new PendingNote(file.relativePath(), title, hash, file.modifiedAt(), isNew, chunks);
    }

    /**
     * Embeds the chunks of all pending notes in batches across note boundaries and persists each note
     * once all of its chunks have vectors.
     */
    private void embedAndPersist(List<PendingNote> pending, int batchSize, Tally t) {
        List<ChunkRef> refs = new ArrayList<>();
        for (PendingNote p : pending) {
            if (p.chunkCount == 0) {
                persist(p, t);
                continue;
            }
            for (int i = 0; i < p.chunkCount; i++) refs.add(new ChunkRef(p, i));
        }

        int batches = (refs.size() + batchSize - 1) / batchSize;
        for (int from = 0, n = 1; from < refs.size(); from += batchSize, n++) {
            checkCancelled();
            List<ChunkRef> live = refs.subList(from, Math.min(from + batchSize, refs.size())).stream()
                    .filter(r -> !r.note.failed)
                    .toList();
            if (live.isEmpty()) continue;

            List<float[]> vectors;
            try {
                vectors = embedding.embedBatch(live.stream().map(ChunkRef::text).toList());
                if (vectors.size() != live.size()) {
                    throw new EmbeddingException("Embedding count mismatch: sent " + live.size()
                            + ", received " + vectors.size());
                }
            } catch (CancellationException | EmbeddingConfigurationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Embedding batch {}/{} failed: {}", n, batches, e.getMessage());
                for (PendingNote p : notesOf(live)) fail(p, "embedding failed: " + e.getMessage(), t);
                continue;
            }
            log.debug("Embedded batch {}/{} ({} chunks)", n, batches, live.size());

            for (int i = 0; i < live.size(); i++) {
                ChunkRef r = live.get(i);
                r.note.accept(r.chunk, vectors.get(i));
            }
            for (PendingNote p : notesOf(live)) {
                if (!p.failed && p.isComplete()) persist(p, t);
            }
        }
    }

    private void persist(PendingNote p, Tally t) {
        checkCancelled();
        try {
            long id = index.upsertNote(p.path, p.title, p.hash, p.modifiedAt);
            try {
                t.chunksRemoved += index.replaceChunksForNote(id, p.embeddedChunks());
            } catch (RuntimeException e) {
                // drop the note so the stored hash cannot hide stale chunks on the next run
                try {
                    index.bulkDeleteNotes(Set.of(p.path));
                } catch (RuntimeException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
            if (p.isNew) t.added++;
            else t.updated++;
            t.chunksCreated += p.chunkCount;
        } catch (CancellationException e) {
            throw e;
        } catch (RuntimeException e) {
            fail(p, "persist failed: " + e.getMessage(), t);
        } finally {
            p.release();
        }
    }

    private void fail(PendingNote p, String message, Tally t) {
        if (p.failed) return;
        p.failed = true;
        p.release();
        log.warn("Skipping {}: {}", p.path, message);
        t.errors.add(p.path + ": " + message);
    }

    private static Set<PendingNote> notesOf(List<ChunkRef> refs) {
        Set<PendingNote> out = new LinkedHashSet<>();
        for (ChunkRef r : refs) out.add(r.note);
        return out;
    }

    // ---------- helpers ----------

    private Path vaultRoot() {
        Path root = Path.of(props.getPath());
        if (!Files.isDirectory(root)) {
            log.error("Vault root missing: {}", root);
            throw new VaultNotFoundException(root);
        }
        return root;
    }

    private int batchSize() {
        return Math.max(1, Math.min(props.getEmbedding().getBatchSize(), embedding.maxBatchSize()));
    }

    static String toVaultPath(Path root, String path) {
        if (path == null || path.isBlank()) throw new IllegalArgumentException("path is blank");
        Path p = Path.of(path);
        Path base = root.toAbsolutePath().normalize();
        Path abs = p.isAbsolute() ? p.normalize() : base.resolve(p).normalize();
        if (!abs.startsWith(base)) {
            throw new IllegalArgumentException("Path is outside the vault: " + path);
        }
        return base.relativize(abs).toString().replace('\\', '/');
    }

    private void lockRun() {
        try {
            runLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for the indexing lock");
        }
    }

    private static void checkCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Indexing cancelled");
        }
    }

    private record ChunkRef(PendingNote note, int chunk) {
        String text() {
            return note.chunkText(chunk);
        }
    }

    private static final class Tally {
        int scanned, added, updated, unchanged, removed, chunksCreated, chunksRemoved;
        final List<String> errors = new ArrayList<>();

        void error(String path, Exception e) {
            String msg = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.warn("Failed to index {}: {}", path, msg);
            errors.add(path + ": " + msg);
        }

        IndexingResult toResult(long t0) {
            return new IndexingResult(scanned, added, updated, unchanged, removed, chunksCreated, chunksRemoved,
                    Duration.ofNanos(System.nanoTime() - t0), errors);
        }
    }
}
