package org.learningjava.vaultsearch.infrastructure.adapter.out.postgres;

import org.learningjava.vaultsearch.application.port.VectorIndexPort;
import org.learningjava.vaultsearch.domain.model.EmbeddedChunk;
import org.learningjava.vaultsearch.domain.model.SearchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Array;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL + pgvector index. Chunk replacement runs in one transaction, so concurrent searches see either
 * the old or the new chunk set of a note. Scores are {@code 1 - cosine_distance / 2}.
 */
public class PostgresVectorIndexAdapter implements VectorIndexPort {

    private static final Logger log = LoggerFactory.getLogger(PostgresVectorIndexAdapter.class);

    private final DataSource ds;
    private final int dimensions;

    public PostgresVectorIndexAdapter(DataSource ds, int dimensions) {
        this.ds = ds;
        this.dimensions = dimensions;
    }

    @Override
    public void ensureSchema() {
        String[] ddl = {
                "CREATE EXTENSION IF NOT EXISTS vector",
                """
                CREATE TABLE IF NOT EXISTS vault_notes (
                    id               BIGSERIAL PRIMARY KEY,
                    file_path        TEXT NOT NULL UNIQUE,
                    title            TEXT,
                    content_hash     TEXT NOT NULL,
                    file_modified_at TIMESTAMPTZ,
                    created_at       TIMESTAMPTZ NOT NULL DEFAULT now(),
                    updated_at       TIMESTAMPTZ NOT NULL DEFAULT now()
                )""",
                """
                CREATE TABLE IF NOT EXISTS vault_chunks (
                    id          BIGSERIAL PRIMARY KEY,
                    note_id     BIGINT NOT NULL REFERENCES vault_notes(id) ON DELETE CASCADE,
                    chunk_index INT NOT NULL,
                    chunk_text  TEXT NOT NULL,
                    start_line  INT,
                    end_line    INT,
                    embedding   vector(%d) NOT NULL,
                    created_at  TIMESTAMPTZ NOT NULL DEFAULT now(),
                    UNIQUE (note_id, chunk_index)
                )""".formatted(dimensions),
                "CREATE INDEX IF NOT EXISTS vault_chunks_note_idx ON vault_chunks(note_id)",
                "CREATE INDEX IF NOT EXISTS vault_chunks_embedding_idx ON vault_chunks USING hnsw (embedding vector_cosine_ops)"
        };
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String sql : ddl) st.execute(sql);
            log.info("Vector index schema ready (dimensions={})", dimensions);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to create vector index schema: " + e.getMessage(), e);
        }
    }

    @Override
    public Map<String, String> loadNoteHashes() {
        Map<String, String> out = new HashMap<>();
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT file_path, content_hash FROM vault_notes");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.put(rs.getString(1), rs.getString(2));
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to load note hashes", e);
        }
    }

    @Override
    public Optional<String> findNoteHash(String filePath) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT content_hash FROM vault_notes WHERE file_path = ?")) {
            ps.setString(1, filePath);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to look up note " + filePath, e);
        }
    }

    @Override
    public long upsertNote(String filePath, String title, String contentHash, Instant fileModifiedAt) {
        String sql = """
                INSERT INTO vault_notes (file_path, title, content_hash, file_modified_at)
                VALUES (?, ?, ?, ?)
                ON CONFLICT (file_path) DO UPDATE SET
                    title = EXCLUDED.title,
                    content_hash = EXCLUDED.content_hash,
                    file_modified_at = EXCLUDED.file_modified_at,
                    updated_at = now()
                RETURNING id
                """;
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, filePath);
            ps.setString(2, title);
            ps.setString(3, contentHash);
            ps.setObject(4, fileModifiedAt == null ? null : OffsetDateTime.ofInstant(fileModifiedAt, ZoneOffset.UTC));
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getLong(1);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to upsert note " + filePath, e);
        }
    }

    @Override
    public int replaceChunksForNote(long noteId, List<EmbeddedChunk> chunks) {
        String insert = """
                INSERT INTO vault_chunks (note_id, chunk_index, chunk_text, start_line, end_line, embedding)
                VALUES (?, ?, ?, ?, ?, ?::vector)
                """;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                int removed;
                try (PreparedStatement del = c.prepareStatement("DELETE FROM vault_chunks WHERE note_id = ?")) {
                    del.setLong(1, noteId);
                    removed = del.executeUpdate();
                }
                try (PreparedStatement ps = c.prepareStatement(insert)) {
                    for (EmbeddedChunk ch : chunks) {
                        ps.setLong(1, noteId);
                        ps.setInt(2, ch.chunkIndex());
                        ps.setString(3, ch.text());
                        ps.setInt(4, ch.chunk().startLine());
                        ps.setInt(5, ch.chunk().endLine());
                        ps.setString(6, toVectorLiteral(ch.embedding()));
                        ps.addBatch();
                    }
                    if (!chunks.isEmpty()) ps.executeBatch();
                }
                c.commit();
                return removed;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to replace chunks for note " + noteId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public List<SearchResult> nearestNeighbors(float[] vector, int k, double minScore) {
        if (k <= 0) return List.of();
        String sql = """
                SELECT n.file_path, n.title, c.chunk_text, c.start_line, c.chunk_index,
                       1 - (c.embedding <=> ?::vector) / 2 AS score
                FROM vault_chunks c
                JOIN vault_notes n ON n.id = c.note_id
                WHERE 1 - (c.embedding <=> ?::vector) / 2 >= ?
                ORDER BY c.embedding <=> ?::vector
                LIMIT ?
                """;
        String literal = toVectorLiteral(vector);
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, literal);
            ps.setString(2, literal);
            ps.setDouble(3, minScore);
            ps.setString(4, literal);
            ps.setInt(5, k);
            List<SearchResult> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SearchResult(
                            rs.getString("file_path"),
                            rs.getString("title"),
                            rs.getString("chunk_text"),
                            rs.getDouble("score"),
                            rs.getInt("start_line"),
                            rs.getInt("chunk_index")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("Vector search failed: " + e.getMessage(), e);
        }
    }

    @Override
    public int bulkDeleteNotes(Set<String> filePaths) {
        if (filePaths == null || filePaths.isEmpty()) return 0;
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                Array paths = c.createArrayOf("text", filePaths.toArray(new String[0]));
                int chunks;
                try (PreparedStatement count = c.prepareStatement("""
                        SELECT count(*) FROM vault_chunks c
                        JOIN vault_notes n ON n.id = c.note_id
                        WHERE n.file_path = ANY(?)
                        """)) {
                    count.setArray(1, paths);
                    try (ResultSet rs = count.executeQuery()) {
                        rs.next();
                        chunks = rs.getInt(1);
                    }
                }
                try (PreparedStatement del = c.prepareStatement("DELETE FROM vault_notes WHERE file_path = ANY(?)")) {
                    del.setArray(1, paths);
                    del.executeUpdate();
                }
                c.commit();
                return chunks;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete " + filePaths.size() + " notes", e);
        }
    }

    @Override
    public boolean isVectorSearchAvailable() {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT 1 FROM pg_extension WHERE extname = 'vector'");
             ResultSet rs = ps.executeQuery()) {
            return rs.next();
        } catch (SQLException e) {
            log.warn("pgvector probe failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public long countNotes() {
        return count("SELECT count(*) FROM vault_notes");
    }

    @Override
    public long countChunks() {
        return count("SELECT count(*) FROM vault_chunks");
    }

    private long count(String sql) {
        try (Connection c = ds.getConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw new IllegalStateException("Count failed: " + sql, e);
        }
    }

    static String toVectorLiteral(float[] v) {
        StringBuilder sb = new StringBuilder(v.length * 8).append('[');
        for (int i = 0; i < v.length; i++) {
            if (i > 0) sb.append(',');
            sb.append(v[i]);
        }
        return sb.append(']').toString();
    }
}
