package org.learningjava.vaultsearch.domain.model;

import java.util.List;

/** Intermediate state of a search, for diagnosing ranking and date translation. */
public record DebugSearch(
        TranslatedQuery translated,
        String combinedQuery,
        int requested,
        List<SearchResult> rawHits,
        List<SearchResult> results
) {}
