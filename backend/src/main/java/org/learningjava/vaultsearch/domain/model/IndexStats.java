package org.learningjava.vaultsearch.domain.model;

public record IndexStats(long noteCount, long chunkCount, boolean vectorSearchAvailable) {}
