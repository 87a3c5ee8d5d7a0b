package org.learningjava.vaultsearch.domain.model;

import java.time.Instant;

/**
 * A markdown note as known to the vector index. {@code filePath} is vault-relative with '/' separators
 * and is the unique key.
 */
public record VaultNote(
        long id,
        String filePath,
        String title,
        String contentHash,
        Instant fileModifiedAt,
        Instant createdAt,
        Instant updatedAt
) {}
