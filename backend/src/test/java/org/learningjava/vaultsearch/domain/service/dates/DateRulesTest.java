package org.learningjava.vaultsearch.domain.service.dates;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Each rule against a fixed reference date. 2026-03-11 is a Wednesday, 2026-01-18 a Sunday.
 */
class DateRulesTest {

    private static final LocalDate WED = LocalDate.of(2026, 3, 11);
    private static final LocalDate SUN = LocalDate.of(2026, 1, 18);

    // --- week of year

    @Test
    void first_week_of_year_is_first_seven_calendar_days() {
        DateResolution r = resolve(new WeekOfYearRule(), "notes from the first week of 2025", WED);

        assertRange(r, "2025-01-01", "2025-01-07");
        assertEquals(28, r.terms().size());
    }

    @Test
    void last_week_of_year_is_not_monday_aligned() {
        DateResolution r = resolve(new WeekOfYearRule(), "Last Week of 2025", WED);

        assertRange(r, "2025-12-25", "2025-12-31");
    }

    // --- week of month

    @Test
    void week_of_future_month_defaults_to_previous_year() {
        assertRange(resolve(new WeekOfMonthRule(), "first week of December", WED), "2025-12-01", "2025-12-07");
    }

    @Test
    void week_of_this_month_name_uses_current_year() {
        assertRange(resolve(new WeekOfMonthRule(), "first week of this December", WED), "2026-12-01", "2026-12-07");
    }

    @Test
    void week_of_last_month_name_is_most_recent_completed_one() {
        assertRange(resolve(new WeekOfMonthRule(), "last week of last March", WED), "2025-03-25", "2025-03-31");
        assertRange(resolve(new WeekOfMonthRule(), "last week of last February", WED), "2026-02-22", "2026-02-28");
    }

    @Test
    void week_of_month_with_explicit_year() {
        assertRange(resolve(new WeekOfMonthRule(), "first week of March 2024", WED), "2024-03-01", "2024-03-07");
    }

    // --- weekend

    @Test
    void weekends_relative_to_a_weekday() {
        WeekendRule rule = new WeekendRule();
        assertRange(resolve(rule, "last weekend", WED), "2026-03-07", "2026-03-08");
        assertRange(resolve(rule, "this weekend", WED), "2026-03-14", "2026-03-15");
        assertRange(resolve(rule, "next weekend", WED), "2026-03-21", "2026-03-22");
    }

    @Test
    void weekends_relative_to_a_sunday() {
        WeekendRule rule = new WeekendRule();
        assertRange(resolve(rule, "this weekend", SUN), "2026-01-17", "2026-01-18");
        assertRange(resolve(rule, "last weekend", SUN), "2026-01-10", "2026-01-11");
        assertRange(resolve(rule, "next weekend", SUN), "2026-01-24", "2026-01-25");
    }

    @Test
    void last_weekend_on_saturday_is_the_previous_one() {
        assertRange(resolve(new WeekendRule(), "last weekend", LocalDate.of(2026, 1, 17)), "2026-01-10", "2026-01-11");
    }

    // --- days

    @Test
    void today_and_yesterday() {
        assertRange(resolve(RelativeDayRule.today(), "today", WED), "2026-03-11", "2026-03-11");
        assertRange(resolve(RelativeDayRule.yesterday(), "YESTERDAY", WED), "2026-03-10", "2026-03-10");
    }

    // --- weeks

    @Test
    void last_week_is_previous_monday_to_sunday_with_week_number() {
        DateResolution r = resolve(RelativeWeekRule.lastWeek(), "last week", WED);

        assertRange(r, "2026-03-02", "2026-03-08");
        assertEquals("2026-W10", r.terms().get(0));
        assertThat(r.terms(), hasItem("March 2, 2026"));
    }

    @Test
    void this_week_ends_today() {
        DateResolution r = resolve(RelativeWeekRule.thisWeek(), "this week", WED);

        assertRange(r, "2026-03-09", "2026-03-11");
        assertEquals("2026-W11", r.terms().get(0));
    }

    @Test
    void week_number_uses_week_based_year() {
        DateResolution r = resolve(RelativeWeekRule.thisWeek(), "this week", LocalDate.of(2026, 1, 1));

        assertRange(r, "2025-12-29", "2026-01-01");
        assertEquals("2026-W01", r.terms().get(0));
    }

    @Test
    void last_weekend_is_not_taken_for_last_week() {
        assertTrue(RelativeWeekRule.lastWeek().resolve("last weekend", WED).isEmpty());
    }

    // --- months

    @Test
    void last_month_is_whole_previous_month() {
        DateResolution r = resolve(RelativeMonthRule.lastMonth(), "last month", WED);

        assertRange(r, "2026-02-01", "2026-02-28");
        assertThat(r.terms(), contains("2026-02", "February 2026"));
    }

    @Test
    void this_month_is_capped_at_today() {
        assertRange(resolve(RelativeMonthRule.thisMonth(), "this month", WED), "2026-03-01", "2026-03-11");
    }

    @Test
    void last_month_in_january_wraps_to_december() {
        assertRange(resolve(RelativeMonthRule.lastMonth(), "last month", SUN), "2025-12-01", "2025-12-31");
    }

    // --- N units ago

    @Test
    void days_weeks_and_months_ago() {
        assertRange(resolve(new UnitsAgoRule(ChronoUnit.DAYS), "3 days ago", WED), "2026-03-08", "2026-03-08");
        assertRange(resolve(new UnitsAgoRule(ChronoUnit.DAYS), "1 day ago", WED), "2026-03-10", "2026-03-10");

        DateResolution weeks = resolve(new UnitsAgoRule(ChronoUnit.WEEKS), "2 weeks ago", WED);
        assertRange(weeks, "2026-02-23", "2026-03-01");
        assertEquals("2026-W09", weeks.terms().get(0));

        assertRange(resolve(new UnitsAgoRule(ChronoUnit.MONTHS), "2 months ago", WED), "2026-01-01", "2026-01-31");
    }

    @Test
    void absurd_offsets_are_ignored() {
        assertTrue(new UnitsAgoRule(ChronoUnit.DAYS).resolve("99999999999999999999 days ago", WED).isEmpty());
        assertTrue(new UnitsAgoRule(ChronoUnit.MONTHS).resolve("999999999999 months ago", WED).isEmpty());
    }

    // --- last weekday

    @Test
    void last_weekday_is_most_recent_prior_occurrence() {
        LastWeekdayRule rule = new LastWeekdayRule();
        assertRange(resolve(rule, "last Friday", WED), "2026-03-06", "2026-03-06");
        assertRange(resolve(rule, "last tuesday", WED), "2026-03-10", "2026-03-10");
    }

    @Test
    void last_weekday_on_same_weekday_goes_back_a_full_week() {
        assertRange(resolve(new LastWeekdayRule(), "last wednesday", WED), "2026-03-04", "2026-03-04");
    }

    // --- specific dates

    @Test
    void iso_and_european_literals() {
        SpecificDateRule rule = new SpecificDateRule();
        assertRange(resolve(rule, "meeting on 2025-11-03", WED), "2025-11-03", "2025-11-03");
        assertRange(resolve(rule, "15.02.2026 notes", WED), "2026-02-15", "2026-02-15");
        assertRange(resolve(rule, "on 15/02/2026", WED), "2026-02-15", "2026-02-15");
    }

    @Test
    void impossible_numeric_dates_are_rejected() {
        SpecificDateRule rule = new SpecificDateRule();
        assertTrue(rule.resolve("2026-02-30", WED).isEmpty());
        assertTrue(rule.resolve("31/04/2026", WED).isEmpty());
        assertTrue(rule.resolve("12.13.2026", WED).isEmpty());
    }

    @Test
    void natural_dates_assume_current_year_unless_in_future() {
        SpecificDateRule rule = new SpecificDateRule();
        assertRange(resolve(rule, "18 January", WED), "2026-01-18", "2026-01-18");
        assertRange(resolve(rule, "January 18th", WED), "2026-01-18", "2026-01-18");
        assertRange(resolve(rule, "December 25th", WED), "2025-12-25", "2025-12-25");
    }

    @Test
    void natural_day_is_clamped_to_month_length() {
        assertRange(resolve(new SpecificDateRule(), "February 30th", WED), "2026-02-28", "2026-02-28");
    }

    // --- month names

    @Test
    void bare_month_resolves_to_most_recent_occurrence() {
        DateResolution r = resolve(new MonthNameRule(), "what happened in December", WED);

        assertRange(r, "2025-12-01", "2025-12-31");
        assertThat(r.terms(), contains("2025-12", "December 2025", "December"));
    }

    @Test
    void bare_current_month_is_capped_at_today() {
        assertRange(resolve(new MonthNameRule(), "march", WED), "2026-03-01", "2026-03-11");
    }

    @Test
    void lower_case_may_as_verb_is_ignored() {
        assertTrue(new MonthNameRule().resolve("what may I have missed", WED).isEmpty());
        assertTrue(new MonthNameRule().resolve("notes I may need", WED).isEmpty());
    }

    @Test
    void lower_case_may_after_preposition_or_before_year_is_the_month() {
        assertRange(resolve(new MonthNameRule(), "what did I do in may", WED), "2025-05-01", "2025-05-31");
        assertRange(resolve(new MonthNameRule(), "anything since may", WED), "2025-05-01", "2025-05-31");
        assertRange(resolve(new MonthNameRule(), "may 2025 trip", WED), "2025-05-01", "2025-05-31");
        assertRange(resolve(new MonthNameRule(), "trips in May", WED), "2025-05-01", "2025-05-31");
    }

    @Test
    void verb_may_is_skipped_for_a_later_month_name() {
        assertRange(resolve(new MonthNameRule(), "I may have met Bob in june", WED), "2025-06-01", "2025-06-30");
    }

    // --- helpers ---

    private static DateResolution resolve(DateRule rule, String query, LocalDate today) {
        Optional<DateResolution> r = rule.resolve(query, today);
        assertTrue(r.isPresent(), () -> rule.name() + " did not match '" + query + "'");
        return r.get();
    }

    private static void assertRange(DateResolution r, String start, String end) {
        assertEquals(LocalDate.parse(start), r.start(), "start");
        assertEquals(LocalDate.parse(end), r.end(), "end");
    }
}
