package org.learningjava.vaultsearch.infrastructure.adapter.out.memory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.vaultsearch.domain.model.EmbeddedChunk;
import org.learningjava.vaultsearch.domain.model.NoteChunk;
import org.learningjava.vaultsearch.domain.model.SearchResult;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class InMemoryVectorIndexAdapterTest {

    private static final Instant MODIFIED = Instant.parse("2026-01-18T10:00:00Z");

    private InMemoryVectorIndexAdapter index;

    @BeforeEach
    void setUp() {
        index = new InMemoryVectorIndexAdapter(Clock.fixed(Instant.parse("2026-03-11T12:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void upsert_keeps_id_and_updates_hash() {
        long id = index.upsertNote("a.md", "A", "H1", MODIFIED);
        long again = index.upsertNote("a.md", "A2", "H2", MODIFIED);

        assertEquals(id, again);
        assertEquals(Optional.of("H2"), index.findNoteHash("a.md"));
        assertEquals(Map.of("a.md", "H2"), index.loadNoteHashes());
        assertEquals(1, index.countNotes());
    }

    @Test
    void replace_swaps_chunk_set_and_reports_old_count() {
        long id = index.upsertNote("a.md", "A", "H", MODIFIED);

        assertEquals(0, index.replaceChunksForNote(id, List.of(chunk(0, "one", 1, 0), chunk(1, "two", 0, 1))));
        assertEquals(2, index.replaceChunksForNote(id, List.of(chunk(0, "only", 1, 1))));
        assertEquals(1, index.countChunks());
    }

    @Test
    void replace_for_unknown_note_fails() {
        assertThrows(IllegalStateException.class, () -> index.replaceChunksForNote(42, List.of()));
    }

    @Test
    void nearest_neighbors_are_ranked_and_filtered() {
        long a = index.upsertNote("a.md", "A", "H", MODIFIED);
        long b = index.upsertNote("b.md", "B", "H", MODIFIED);
        index.replaceChunksForNote(a, List.of(chunk(0, "same", 1, 0)));
        index.replaceChunksForNote(b, List.of(chunk(0, "orthogonal", 0, 1), chunk(1, "opposite", -1, 0)));

        List<SearchResult> hits = index.nearestNeighbors(new float[]{1, 0}, 10, 0.4);

        assertThat(hits.stream().map(SearchResult::chunkText).toList(), contains("same", "orthogonal"));
        assertEquals(1.0, hits.get(0).score(), 1e-9);
        assertEquals(0.5, hits.get(1).score(), 1e-9);
        assertEquals("A", hits.get(0).title());
    }

    @Test
    void nearest_neighbors_respects_k() {
        long a = index.upsertNote("a.md", "A", "H", MODIFIED);
        index.replaceChunksForNote(a, List.of(chunk(0, "x", 1, 0), chunk(1, "y", 1, 1), chunk(2, "z", 0, 1)));

        assertEquals(2, index.nearestNeighbors(new float[]{1, 0}, 2, 0.0).size());
        assertTrue(index.nearestNeighbors(new float[]{1, 0}, 0, 0.0).isEmpty());
    }

    @Test
    void bulk_delete_removes_notes_and_counts_chunks() {
        long a = index.upsertNote("a.md", "A", "H", MODIFIED);
        index.upsertNote("b.md", "B", "H", MODIFIED);
        index.replaceChunksForNote(a, List.of(chunk(0, "x", 1, 0), chunk(1, "y", 0, 1)));

        assertEquals(2, index.bulkDeleteNotes(Set.of("a.md", "missing.md")));
        assertEquals(1, index.countNotes());
        assertEquals(0, index.countChunks());
        assertEquals(0, index.bulkDeleteNotes(Set.of()));
    }

    @Test
    void zero_vector_scores_neutral() {
        assertEquals(0.5, InMemoryVectorIndexAdapter.score(new float[]{0, 0}, new float[]{1, 0}), 1e-9);
        assertThrows(IllegalArgumentException.class,
                () -> InMemoryVectorIndexAdapter.score(new float[]{1}, new float[]{1, 0}));
    }

    // ---------- helpers ----------

    private static EmbeddedChunk chunk(int index, String text, float x, float y) {
        return new EmbeddedChunk(new NoteChunk(index, text, index, index), new float[]{x, y});
    }
}
