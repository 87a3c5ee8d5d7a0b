package org.learningjava.vaultsearch.domain.service.dates;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;

/** "last Friday": most recent prior occurrence, a full week back when today is that weekday. */
public class LastWeekdayRule extends PatternDateRule {

    public LastWeekdayRule() {
        super("last-weekday", "\\blast\\s+(" + Months.WEEKDAY_NAMES + ")\\b");
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        DayOfWeek target = Months.parseWeekday(m.group(1));
        int back = (7 + today.getDayOfWeek().getValue() - target.getValue()) % 7;
        if (back == 0) back = 7;
        return Optional.of(DateResolution.day(today.minusDays(back)));
    }
}
