package org.learningjava.vaultsearch.domain.service.dates;

import org.learningjava.vaultsearch.domain.model.TranslatedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rewrites relative date phrases ("last week", "January 1st", "3 days ago") into literal date terms and a range.
 * <p>
 * Rules run in a fixed order, most specific first. Every matching rule contributes its terms; only the first
 * matching rule sets the range. Order matters: the specific-date rule must see "January 1st" before the bare
 * month rule turns it into the whole of January.
 */
public class DateQueryTranslator {

    private static final Logger log = LoggerFactory.getLogger(DateQueryTranslator.class);

    private final List<DateRule> rules;

    public DateQueryTranslator() {
        this(defaultRules());
    }

    public DateQueryTranslator(List<DateRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static List<DateRule> defaultRules() {
        return List.of(
                new WeekOfYearRule(),
                new WeekOfMonthRule(),
                new WeekendRule(),
                RelativeDayRule.yesterday(),
                RelativeDayRule.today(),
                RelativeWeekRule.lastWeek(),
                RelativeWeekRule.thisWeek(),
                RelativeMonthRule.lastMonth(),
                RelativeMonthRule.thisMonth(),
                new UnitsAgoRule(ChronoUnit.DAYS),
                new UnitsAgoRule(ChronoUnit.WEEKS),
                new UnitsAgoRule(ChronoUnit.MONTHS),
                new LastWeekdayRule(),
                new SpecificDateRule(),
                new MonthNameRule()
        );
    }

    public List<DateRule> rules() {
        return rules;
    }

    public TranslatedQuery translate(String query, LocalDate today) {
        if (query == null || query.isBlank()) return TranslatedQuery.unchanged(query == null ? "" : query);

        Set<String> terms = new LinkedHashSet<>();
        LocalDate start = null;
        LocalDate end = null;

        for (DateRule rule : rules) {
            Optional<DateResolution> hit = rule.resolve(query, today);
            if (hit.isEmpty()) continue;

            DateResolution r = hit.get();
            if (start == null) {
                start = r.start();
                end = r.end();
                log.debug("Date rule '{}' set range {}..{} for '{}'", rule.name(), start, end, query);
            }
            terms.addAll(r.terms());
        }

        return new TranslatedQuery(query, new ArrayList<>(terms), start, end);
    }
}
