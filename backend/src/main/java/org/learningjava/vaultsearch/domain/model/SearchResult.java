package org.learningjava.vaultsearch.domain.model;

/** One ranked chunk hit. Score is cosine-derived and lies in 0..1. */
public record SearchResult(
        String filePath,
        String title,
        String chunkText,
        double score,
        int startLine,
        int chunkIndex
) {}
