package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.util.Optional;

/**
 * One recognizer/resolver pair for a family of date phrases.
 */
public interface DateRule {

    String name();

    /**
     * @param query free text as typed by the user
     * @param today reference date the phrase is relative to
     * @return the resolved range and literal terms, or empty when the phrase is absent or does not denote a real date
     */
    Optional<DateResolution> resolve(String query, LocalDate today);
}
