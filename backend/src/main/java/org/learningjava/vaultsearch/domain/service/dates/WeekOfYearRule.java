package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * "first/last week of 2025": the first or last seven calendar days of the year. Not aligned to Mondays.
 */
public class WeekOfYearRule extends PatternDateRule {

    public WeekOfYearRule() {
        super("week-of-year", "\\b(first|last)\\s+week\\s+of\\s+(\\d{4})\\b");
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        int year = Integer.parseInt(m.group(2));
        if ("last".equals(lower(m.group(1)))) {
            LocalDate end = LocalDate.of(year, 12, 31);
            return Optional.of(DateResolution.days(end.minusDays(6), end));
        }
        LocalDate start = LocalDate.of(year, 1, 1);
        return Optional.of(DateResolution.days(start, start.plusDays(6)));
    }
}
