package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.time.Month;
import java.time.YearMonth;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A literal date: ISO {@code 2026-01-18}, European {@code 18.01.2026} or {@code 18/01/2026},
 * or natural "18 January" / "January 18th". Natural dates without a year take the current year,
 * or the previous one when that would lie in the future.
 */
public class SpecificDateRule implements DateRule {

    private static final Pattern ISO = Pattern.compile("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b");
    private static final Pattern EUROPEAN = Pattern.compile("\\b(\\d{1,2})[./](\\d{1,2})[./](\\d{4})\\b");
    private static final Pattern NATURAL = Pattern.compile(
            "\\b(?:(\\d{1,2})(?:st|nd|rd|th)?\\s+(" + Months.MONTH_NAMES + ")|(" + Months.MONTH_NAMES
                    + ")\\s+(\\d{1,2})(?:st|nd|rd|th)?)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    @Override
    public String name() {
        return "specific-date";
    }

    @Override
    public Optional<DateResolution> resolve(String query, LocalDate today) {
        return iso(query)
                .or(() -> european(query))
                .or(() -> natural(query, today))
                .map(DateResolution::day);
    }

    private Optional<LocalDate> iso(String query) {
        Matcher m = ISO.matcher(query);
        while (m.find()) {
            Optional<LocalDate> date = validDate(
                    Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)));
            if (date.isPresent()) return date;
        }
        return Optional.empty();
    }

    private Optional<LocalDate> european(String query) {
        Matcher m = EUROPEAN.matcher(query);
        while (m.find()) {
            int day = Integer.parseInt(m.group(1));
            int month = Integer.parseInt(m.group(2));
            int year = Integer.parseInt(m.group(3));
            Optional<LocalDate> date = validDate(year, month, day);
            if (date.isPresent()) return date;
        }
        return Optional.empty();
    }

    private Optional<LocalDate> natural(String query, LocalDate today) {
        Matcher m = NATURAL.matcher(query);
        while (m.find()) {
            boolean dayFirst = m.group(1) != null;
            String dayText = dayFirst ? m.group(1) : m.group(4);
            String monthText = dayFirst ? m.group(2) : m.group(3);

            int day = Integer.parseInt(dayText);
            Optional<Month> month = Months.parseMonth(monthText);
            if (day < 1 || month.isEmpty()) continue;

            LocalDate candidate = clamped(today.getYear(), month.get(), day);
            if (candidate.isAfter(today)) {
                candidate = clamped(today.getYear() - 1, month.get(), day);
            }
            return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private static Optional<LocalDate> validDate(int year, int month, int day) {
        if (month < 1 || month > 12 || day < 1) return Optional.empty();
        if (day > YearMonth.of(year, month).lengthOfMonth()) return Optional.empty();
        return Optional.of(LocalDate.of(year, month, day));
    }

    private static LocalDate clamped(int year, Month month, int day) {
        YearMonth ym = YearMonth.of(year, month);
        return ym.atDay(Math.min(day, ym.lengthOfMonth()));
    }
}
