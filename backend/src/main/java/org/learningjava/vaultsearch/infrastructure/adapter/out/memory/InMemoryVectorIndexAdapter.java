package org.learningjava.vaultsearch.infrastructure.adapter.out.memory;

import org.learningjava.vaultsearch.application.port.VectorIndexPort;
import org.learningjava.vaultsearch.domain.model.EmbeddedChunk;
import org.learningjava.vaultsearch.domain.model.SearchResult;
import org.learningjava.vaultsearch.domain.model.VaultNote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-local index with brute-force cosine search. Writers take the write lock, so a reader sees
 * a note's chunk list either entirely before or entirely after a replace.
 */
public class InMemoryVectorIndexAdapter implements VectorIndexPort {

    private static final Logger log = LoggerFactory.getLogger(InMemoryVectorIndexAdapter.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, VaultNote> notesByPath = new HashMap<>();
    private final Map<Long, List<EmbeddedChunk>> chunksByNote = new HashMap<>();
    private final Clock clock;
    private long nextId = 1;

    public InMemoryVectorIndexAdapter(Clock clock) {
        this.clock = clock;
    }

    public InMemoryVectorIndexAdapter() {
        this(Clock.systemUTC());
    }

    @Override
    public void ensureSchema() {
        log.info("Using in-memory vector index");
    }

    @Override
    public Map<String, String> loadNoteHashes() {
        lock.readLock().lock();
        try {
            Map<String, String> out = new HashMap<>();
            notesByPath.forEach((path, n) -> out.put(path, n.contentHash()));
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<String> findNoteHash(String filePath) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(notesByPath.get(filePath)).map(VaultNote::contentHash);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long upsertNote(String filePath, String title, String contentHash, Instant fileModifiedAt) {
        lock.writeLock().lock();
        try {
            Instant now = clock.instant();
            VaultNote existing = notesByPath.get(filePath);
            VaultNote note = existing == null
                    ? new VaultNote(nextId++, filePath, title, contentHash, fileModifiedAt, now, now)
                    : new VaultNote(existing.id(), filePath, title, contentHash, fileModifiedAt, existing.createdAt(), now);
            notesByPath.put(filePath, note);
            return note.id();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int replaceChunksForNote(long noteId, List<EmbeddedChunk> chunks) {
        List<EmbeddedChunk> copy = List.copyOf(chunks);
        lock.writeLock().lock();
        try {
            boolean known = notesByPath.values().stream().anyMatch(n -> n.id() == noteId);
            if (!known) throw new IllegalStateException("No note with id " + noteId);
            List<EmbeddedChunk> old = chunksByNote.put(noteId, copy);
            return old == null ? 0 : old.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<SearchResult> nearestNeighbors(float[] vector, int k, double minScore) {
        if (k <= 0) return List.of();
        lock.readLock().lock();
        try {
            List<SearchResult> hits = new ArrayList<>();
            for (VaultNote note : notesByPath.values()) {
                for (EmbeddedChunk c : chunksByNote.getOrDefault(note.id(), List.of())) {
                    double score = score(vector, c.embedding());
                    if (score < minScore) continue;
                    hits.add(new SearchResult(note.filePath(), note.title(), c.text(), score,
                            c.chunk().startLine(), c.chunkIndex()));
                }
            }
            hits.sort(Comparator.comparingDouble(SearchResult::score).reversed());
            return hits.size() > k ? new ArrayList<>(hits.subList(0, k)) : hits;
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public int bulkDeleteNotes(Set<String> filePaths) {
        if (filePaths == null || filePaths.isEmpty()) return 0;
        lock.writeLock().lock();
        try {
            int removedChunks = 0;
            for (String path : filePaths) {
                VaultNote n = notesByPath.remove(path);
                if (n == null) continue;
                List<EmbeddedChunk> old = chunksByNote.remove(n.id());
                if (old != null) removedChunks += old.size();
            }
            return removedChunks;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isVectorSearchAvailable() {
        return true;
    }

    @Override
    public long countNotes() {
        lock.readLock().lock();
        try {
            return notesByPath.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long countChunks() {
        lock.readLock().lock();
        try {
            return chunksByNote.values().stream().mapToLong(List::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** Cosine similarity mapped from -1..1 onto 0..1, i.e. {@code 1 - cosineDistance / 2}. */
    static double score(float[] a, float[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Dimension mismatch: " + a.length + " vs " + b.length);
        }
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            na += a[i] * a[i];
            nb += b[i] * b[i];
        }
        if (na == 0 || nb == 0) return 0.5;
        double cosine = dot / (Math.sqrt(na) * Math.sqrt(nb));
        return 1.0 - (1.0 - cosine) / 2.0;
    }
}
