package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * "N days/weeks/months ago". Days resolve to one day, weeks to the Monday-aligned week,
 * months to the whole calendar month.
 */
public class UnitsAgoRule extends PatternDateRule {

    private final ChronoUnit unit;

    public UnitsAgoRule(ChronoUnit unit) {
        super(singular(unit) + "s-ago", "\\b(\\d+)\\s+" + singular(unit) + "s?\\s+ago\\b");
        this.unit = unit;
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        long n = Long.parseLong(m.group(1));
        return switch (unit) {
            case DAYS -> Optional.of(DateResolution.day(today.minusDays(n)));
            case WEEKS -> {
                LocalDate monday = Months.mondayOf(today).minusWeeks(n);
                yield Optional.of(DateResolution.week(monday, monday.plusDays(6)));
            }
            case MONTHS -> Optional.of(DateResolution.month(YearMonth.from(today).minusMonths(n), null, false));
            default -> Optional.empty();
        };
    }

    private static String singular(ChronoUnit unit) {
        return switch (unit) {
            case DAYS -> "day";
            case WEEKS -> "week";
            case MONTHS -> "month";
            default -> throw new IllegalArgumentException("Unsupported unit: " + unit);
        };
    }
}
