package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * A bare month name, lowest priority. Resolves to the most recent occurrence of that month;
 * the current month is capped at today. A lower-case "may" only counts as the month after
 * a preposition ("in may", "since may") or before a year ("may 2025"); elsewhere it is the verb.
 */
public class MonthNameRule extends PatternDateRule {

    public MonthNameRule() {
        super("month-name", "\\b(?:(in|of|during|since|until|from|before|after)\\s+)?("
                + Months.MONTH_NAMES + ")\\b(\\s+\\d{4}\\b)?");
    }

    @Override
    public Optional<DateResolution> resolve(String query, LocalDate today) {
        Matcher m = matcher(query);
        while (m.find()) {
            if (isModalMay(m)) continue;
            return resolveSafely(m, today);
        }
        return Optional.empty();
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        Optional<Month> month = Months.parseMonth(m.group(2));
        if (month.isEmpty()) return Optional.empty();
        YearMonth ym = YearMonth.of(Months.mostRecentYear(month.get(), today), month.get());
        return Optional.of(DateResolution.month(ym, today, true));
    }

    private static boolean isModalMay(Matcher m) {
        return "may".equals(m.group(2)) && m.group(1) == null && m.group(3) == null;
    }
}
