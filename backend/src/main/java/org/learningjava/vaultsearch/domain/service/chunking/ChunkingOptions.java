package org.learningjava.vaultsearch.domain.service.chunking;

/**
 * Size budget for chunking, in approximate tokens. One token is counted as {@value #CHARS_PER_TOKEN} characters.
 */
public record ChunkingOptions(int targetTokens, int overlapTokens) {

    public static final int CHARS_PER_TOKEN = 4;

    public static final ChunkingOptions DEFAULTS = new ChunkingOptions(500, 50);

    public ChunkingOptions {
        if (targetTokens <= 0) {
            throw new IllegalArgumentException("targetTokens must be > 0, got " + targetTokens);
        }
        if (overlapTokens < 0 || overlapTokens >= targetTokens) {
            throw new IllegalArgumentException("overlapTokens must be in [0, targetTokens), got " + overlapTokens);
        }
    }

    public int targetChars() { return targetTokens * CHARS_PER_TOKEN; }

    public int overlapChars() { return overlapTokens * CHARS_PER_TOKEN; }
}
