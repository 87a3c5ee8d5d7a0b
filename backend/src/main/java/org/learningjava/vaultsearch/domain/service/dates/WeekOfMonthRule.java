package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * "first/last week of [last|this] December [2025]": first or last seven days of the month.
 * An explicit year wins, "this" means the current year, "last" means the most recent completed
 * occurrence; otherwise a month still ahead of today resolves to the previous year.
 */
public class WeekOfMonthRule extends PatternDateRule {

    public WeekOfMonthRule() {
        super("week-of-month", "\\b(first|last)\\s+week\\s+of\\s+(?:(last|this)\\s+)?(" + Months.MONTH_NAMES
                + ")(?:\\s+(\\d{4}))?\\b");
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        Optional<Month> parsed = Months.parseMonth(m.group(3));
        if (parsed.isEmpty()) return Optional.empty();
        Month month = parsed.get();

        String modifier = lower(m.group(2));
        int year;
        if (m.group(4) != null) {
            year = Integer.parseInt(m.group(4));
        } else if ("this".equals(modifier)) {
            year = today.getYear();
        } else if ("last".equals(modifier)) {
            year = month.getValue() >= today.getMonthValue() ? today.getYear() - 1 : today.getYear();
        } else {
            year = Months.mostRecentYear(month, today);
        }

        YearMonth ym = YearMonth.of(year, month);
        if ("last".equals(lower(m.group(1)))) {
            LocalDate end = ym.atEndOfMonth();
            return Optional.of(DateResolution.days(end.minusDays(6), end));
        }
        LocalDate start = ym.atDay(1);
        return Optional.of(DateResolution.days(start, start.plusDays(6)));
    }
}
