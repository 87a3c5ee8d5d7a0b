package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.YearMonth;
import java.time.format.DateTimeFormatter;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Literal spellings of dates as they tend to appear in note names and bodies.
 */
public final class DateTerms {

    private static final DateTimeFormatter ISO_DASH = DateTimeFormatter.ofPattern("yyyy-MM-dd", Locale.ENGLISH);
    private static final DateTimeFormatter ISO_COMPACT = DateTimeFormatter.ofPattern("yyyyMMdd", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_DAY_YEAR = DateTimeFormatter.ofPattern("MMMM d, yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter DAY_MONTH_YEAR = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter YEAR_MONTH = DateTimeFormatter.ofPattern("yyyy-MM", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH_YEAR = DateTimeFormatter.ofPattern("MMMM yyyy", Locale.ENGLISH);
    private static final DateTimeFormatter MONTH = DateTimeFormatter.ofPattern("MMMM", Locale.ENGLISH);

    private DateTerms() {}

    public static List<String> dayTerms(LocalDate from, LocalDate to) {
        List<String> out = new ArrayList<>();
        for (LocalDate d = from; !d.isAfter(to); d = d.plusDays(1)) {
            out.add(d.format(ISO_DASH));
            out.add(d.format(ISO_COMPACT));
            out.add(d.format(MONTH_DAY_YEAR));
            out.add(d.format(DAY_MONTH_YEAR));
        }
        return out;
    }

    public static List<String> monthTerms(YearMonth month) {
        return List.of(month.format(YEAR_MONTH), month.format(MONTH_YEAR));
    }

    public static String monthName(YearMonth month) {
        return month.format(MONTH);
    }

    /** ISO-8601 week label, e.g. {@code 2026-W03}. Uses the week-based year. */
    public static String isoWeek(LocalDate day) {
        int year = day.get(IsoFields.WEEK_BASED_YEAR);
        int week = day.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format(Locale.ROOT, "%d-W%02d", year, week);
    }
}
