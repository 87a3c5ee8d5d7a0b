package org.learningjava.vaultsearch.domain.service.dates;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Optional;
import java.util.regex.Matcher;

/** "last/this/next weekend": the Saturday and Sunday before, containing or after today. */
public class WeekendRule extends PatternDateRule {

    public WeekendRule() {
        super("weekend", "\\b(last|this|next)\\s+weekend\\b");
    }

    @Override
    protected Optional<DateResolution> resolve(Matcher m, LocalDate today) {
        LocalDate saturday;
        switch (lower(m.group(1))) {
            case "last" -> saturday = previousSaturday(today);
            case "next" -> saturday = currentSaturday(today).plusDays(7);
            default -> saturday = currentSaturday(today);
        }
        return Optional.of(DateResolution.days(saturday, saturday.plusDays(1)));
    }

    static LocalDate previousSaturday(LocalDate today) {
        DayOfWeek dow = today.getDayOfWeek();
        if (dow == DayOfWeek.SUNDAY) return today.minusDays(8);
        if (dow == DayOfWeek.SATURDAY) return today.minusDays(7);
        return today.minusDays(dow.getValue() + 1L);
    }

    /** Saturday of the weekend containing today, or the coming one on a weekday. */
    static LocalDate currentSaturday(LocalDate today) {
        DayOfWeek dow = today.getDayOfWeek();
        if (dow == DayOfWeek.SUNDAY) return today.minusDays(1);
        return today.plusDays(DayOfWeek.SATURDAY.getValue() - dow.getValue());
    }
}
