package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;

/** "last month" is the whole previous calendar month; "this month" ends today. */
public class RelativeMonthRule extends PatternDateRule {

    private final boolean previous;

    private RelativeMonthRule(String word, boolean previous) {
        super(word + "-month", "\\b" + word + "\\s+month\\b");
        this.previous = previous;
    }

    public static RelativeMonthRule lastMonth() {
        return new RelativeMonthRule("last", true);
    }

    public static RelativeMonthRule thisMonth() {
        return new RelativeMonthRule("this", false);
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        YearMonth current = YearMonth.from(today);
        if (previous) {
            return Optional.of(DateResolution.month(current.minusMonths(1), null, false));
        }
        return Optional.of(DateResolution.month(current, today, false));
    }
}
