package org.learningjava.vaultsearch.domain.service.dates;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Base for rules recognized by a single case-insensitive pattern. Only the first match in the query is used.
 */
public abstract class PatternDateRule implements DateRule {

    private static final Logger log = LoggerFactory.getLogger(PatternDateRule.class);

    private final String name;
    private final Pattern pattern;

    protected PatternDateRule(String name, String regex) {
        this.name = name;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Optional<DateResolution> resolve(String query, LocalDate today) {
        Matcher m = matcher(query);
        if (!m.find()) return Optional.empty();
        return resolveSafely(m, today);
    }

    protected Matcher matcher(String query) {
        return pattern.matcher(query);
    }

    /** Arithmetic on absurd inputs ("99999999 days ago") is treated as no match rather than an error. */
    protected Optional<DateResolution> resolveSafely(Matcher match, LocalDate today) {
        try {
            return resolve(match, today);
        } catch (DateTimeException | NumberFormatException | ArithmeticException e) {
            log.debug("Rule {} ignored '{}': {}", name, match.group(), e.getMessage());
            return Optional.empty();
        }
    }

    protected abstract Optional<DateResolution> resolve(Matcher match, LocalDate today);

    protected static String lower(String s) {
        return s == null ? null : s.toLowerCase(Locale.ROOT);
    }
}
