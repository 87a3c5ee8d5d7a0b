package org.learningjava.vaultsearch.infrastructure.adapter.out.openai;

import java.time.Duration;

/**
 * Capped exponential backoff: {@code min(initial * multiplier^attempt, max)}. {@code maxAttempts} counts
 * the first call.
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff, double multiplier) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(30), 2.0);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1.0");
    }

    public Duration delayFor(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, attempt);
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(Math.max(capped, 0L));
    }
}
