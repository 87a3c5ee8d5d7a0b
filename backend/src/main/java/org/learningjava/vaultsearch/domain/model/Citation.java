package org.learningjava.vaultsearch.domain.model;

import java.time.LocalDate;

/**
 * A search hit prepared for display. {@code noteDate} comes from a {@code YYYY-MM-DD} filename when present.
 */
public record Citation(
        String filePath,
        String title,
        LocalDate noteDate,
        String uri,
        double score,
        String snippet
) {}
