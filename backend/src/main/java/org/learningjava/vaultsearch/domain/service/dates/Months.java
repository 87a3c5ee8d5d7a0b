package org.learningjava.vaultsearch.domain.service.dates;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.Month;
import java.util.Locale;
import java.util.Optional;

/** Month and weekday name parsing plus calendar helpers shared by the rules. */
final class Months {

    static final String MONTH_NAMES =
            "january|february|march|april|may|june|july|august|september|october|november|december";
    static final String WEEKDAY_NAMES = "monday|tuesday|wednesday|thursday|friday|saturday|sunday";

    private Months() {}

    static Optional<Month> parseMonth(String name) {
        if (name == null || name.length() < 3) return Optional.empty();
        String prefix = name.substring(0, 3).toLowerCase(Locale.ROOT);
        for (Month m : Month.values()) {
            if (m.name().toLowerCase(Locale.ROOT).startsWith(prefix)) return Optional.of(m);
        }
        return Optional.empty();
    }

    static DayOfWeek parseWeekday(String name) {
        return DayOfWeek.valueOf(name.toUpperCase(Locale.ROOT));
    }

    /** Year of the most recent occurrence of {@code month}, counting the current month as recent. */
    static int mostRecentYear(Month month, LocalDate today) {
        return month.getValue() > today.getMonthValue() ? today.getYear() - 1 : today.getYear();
    }

    static LocalDate mondayOf(LocalDate day) {
        return day.minusDays(day.getDayOfWeek().getValue() - 1L);
    }
}
