package org.learningjava.vaultsearch.domain.service.dates;

import org.junit.jupiter.api.Test;
import org.learningjava.vaultsearch.domain.model.TranslatedQuery;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;

class DateQueryTranslatorTest {

    private static final LocalDate WED = LocalDate.of(2026, 3, 11);

    private final DateQueryTranslator translator = new DateQueryTranslator();

    @Test
    void yesterday_resolves_to_single_day_with_literal_terms() {
        TranslatedQuery q = translator.translate("what did I do yesterday", LocalDate.of(2026, 1, 19));

        assertThat(q.dateTerms(), hasItems("2026-01-18", "20260118", "January 18, 2026", "18 January 2026"));
        assertEquals(LocalDate.of(2026, 1, 18), q.startDate());
        assertEquals(LocalDate.of(2026, 1, 18), q.endDate());
    }

    @Test
    void specific_date_beats_bare_month_name() {
        TranslatedQuery q = translator.translate("January 1st", LocalDate.of(2026, 6, 1));

        assertEquals(LocalDate.of(2026, 1, 1), q.startDate());
        assertEquals(LocalDate.of(2026, 1, 1), q.endDate());
        // the month rule still contributes its terms
        assertThat(q.dateTerms(), hasItems("2026-01-01", "2026-01", "January 2026"));
    }

    @Test
    void lower_case_month_after_in_gets_a_range() {
        TranslatedQuery q = translator.translate("what did I do in may", LocalDate.of(2025, 6, 10));

        assertTrue(q.hasDateRange());
        assertEquals(LocalDate.of(2025, 5, 1), q.startDate());
        assertEquals(LocalDate.of(2025, 5, 31), q.endDate());
        assertThat(q.dateTerms(), hasItems("2025-05", "May 2025"));
    }

    @Test
    void combined_query_appends_terms_in_order() {
        TranslatedQuery q = translator.translate("yesterday", WED);

        assertEquals("yesterday 2026-03-10 20260310 March 10, 2026 10 March 2026", q.combinedQuery());
    }

    @Test
    void query_without_dates_is_unchanged() {
        TranslatedQuery q = translator.translate("walks with the dog", WED);

        assertTrue(q.dateTerms().isEmpty());
        assertFalse(q.hasDateRange());
        assertEquals("walks with the dog", q.combinedQuery());
    }

    @Test
    void blank_query_yields_empty_translation() {
        TranslatedQuery q = translator.translate("  ", WED);

        assertTrue(q.dateTerms().isEmpty());
        assertNull(q.startDate());
    }

    @Test
    void rule_order_not_phrase_position_decides_the_range() {
        TranslatedQuery q = translator.translate("last month and also yesterday", WED);

        assertEquals(LocalDate.of(2026, 3, 10), q.startDate());
        assertEquals(LocalDate.of(2026, 3, 10), q.endDate());
        assertThat(q.dateTerms(), hasItems("2026-03-10", "2026-02", "February 2026"));
    }

    @Test
    void week_of_month_does_not_also_trigger_last_week() {
        TranslatedQuery q = translator.translate("last week of December", WED);

        assertEquals(LocalDate.of(2025, 12, 25), q.startDate());
        assertEquals(LocalDate.of(2025, 12, 31), q.endDate());
        assertThat(q.dateTerms(), not(hasItem("2026-W10")));
        assertThat(q.dateTerms(), hasItem("December 2025"));
    }

    @Test
    void terms_are_not_duplicated_when_rules_overlap() {
        TranslatedQuery q = translator.translate("today, 2026-03-11", WED);

        assertEquals(1, q.dateTerms().stream().filter("2026-03-11"::equals).count());
    }

    @Test
    void custom_rule_list_is_used_in_given_order() {
        DateRule fixed = new DateRule() {
            @Override public String name() { return "fixed"; }
            @Override public Optional<DateResolution> resolve(String query, LocalDate today) {
                return Optional.of(DateResolution.day(LocalDate.of(2000, 1, 1)));
            }
        };
        DateQueryTranslator t = new DateQueryTranslator(List.of(fixed, RelativeDayRule.yesterday()));

        TranslatedQuery q = t.translate("yesterday", WED);

        assertEquals(LocalDate.of(2000, 1, 1), q.startDate());
        assertThat(q.dateTerms(), hasItems("2000-01-01", "2026-03-10"));
    }

    @Test
    void default_rules_run_most_specific_first() {
        List<String> names = translator.rules().stream().map(DateRule::name).toList();

        assertEquals(List.of(
                "week-of-year", "week-of-month", "weekend", "yesterday", "today",
                "last-week", "this-week", "last-month", "this-month",
                "days-ago", "weeks-ago", "months-ago",
                "last-weekday", "specific-date", "month-name"), names);
    }
}
