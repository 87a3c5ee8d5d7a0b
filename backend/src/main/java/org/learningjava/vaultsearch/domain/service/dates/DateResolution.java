package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

public record DateResolution(LocalDate start, LocalDate end, List<String> terms) {

    public DateResolution {
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("Range start " + start + " is after end " + end);
        }
        terms = List.copyOf(terms);
    }

    /** A range whose terms are every day in four literal formats. */
    public static DateResolution days(LocalDate start, LocalDate end) {
        return new DateResolution(start, end, DateTerms.dayTerms(start, end));
    }

    public static DateResolution day(LocalDate day) {
        return days(day, day);
    }

    /**
     * Calendar month, optionally capped at {@code cap}. Terms are the month spellings, not every day.
     */
    public static DateResolution month(YearMonth month, LocalDate cap, boolean withBareName) {
        LocalDate start = month.atDay(1);
        LocalDate end = month.atEndOfMonth();
        if (cap != null && cap.isBefore(end) && !cap.isBefore(start)) end = cap;
        List<String> terms = new ArrayList<>(DateTerms.monthTerms(month));
        if (withBareName) terms.add(DateTerms.monthName(month));
        return new DateResolution(start, end, terms);
    }

    /** Monday-aligned week: ISO week-number term first, then the per-day terms. */
    public static DateResolution week(LocalDate monday, LocalDate end) {
        List<String> terms = new ArrayList<>();
        terms.add(DateTerms.isoWeek(monday));
        terms.addAll(DateTerms.dayTerms(monday, end));
        return new DateResolution(monday, end, terms);
    }
}
