package org.learningjava.vaultsearch.domain.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * A user query with its relative date phrases resolved to concrete literal terms and, optionally, a date range.
 */
public record TranslatedQuery(
        String originalQuery,
        List<String> dateTerms,
        LocalDate startDate,
        LocalDate endDate
) {
    public TranslatedQuery {
        dateTerms = List.copyOf(dateTerms);
    }

    public static TranslatedQuery unchanged(String query) {
        return new TranslatedQuery(query, List.of(), null, null);
    }

    public boolean hasDateRange() {
        return startDate != null && endDate != null;
    }

    public Optional<LocalDate> start() { return Optional.ofNullable(startDate); }

    public Optional<LocalDate> end() { return Optional.ofNullable(endDate); }

    /** Original text followed by every date term, space separated. */
    public String combinedQuery() {
        if (dateTerms.isEmpty()) return originalQuery;
        return originalQuery + " " + String.join(" ", dateTerms);
    }
}
