package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;

/**
 * "last week" is the previous Monday to Sunday; "this week" runs from this Monday to today.
 * "last week of ..." is left to the week-of-month and week-of-year rules.
 */
public class RelativeWeekRule extends PatternDateRule {

    private final boolean previous;

    private RelativeWeekRule(String word, boolean previous) {
        super(word + "-week", "\\b" + word + "\\s+week\\b(?!\\s+of\\b)");
        this.previous = previous;
    }

    public static RelativeWeekRule lastWeek() {
        return new RelativeWeekRule("last", true);
    }

    public static RelativeWeekRule thisWeek() {
        return new RelativeWeekRule("this", false);
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        LocalDate monday = Months.mondayOf(today);
        if (previous) {
            LocalDate lastMonday = monday.minusWeeks(1);
            return Optional.of(DateResolution.week(lastMonday, lastMonday.plusDays(6)));
        }
        return Optional.of(DateResolution.week(monday, today));
    }
}
