package org.learningjava.vaultsearch.domain.service.dates;

import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;

/** A single named day relative to today. */
public class RelativeDayRule extends PatternDateRule {

    private final int offsetDays;

    public RelativeDayRule(String word, int offsetDays) {
        super(word, "\\b" + word + "\\b");
        this.offsetDays = offsetDays;
    }

    public static RelativeDayRule yesterday() {
        return new RelativeDayRule("yesterday", -1);
    }

    public static RelativeDayRule today() {
        return new RelativeDayRule("today", 0);
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        return Optional.of(DateResolution.day(today.plusDays(offsetDays)));
    }
}
