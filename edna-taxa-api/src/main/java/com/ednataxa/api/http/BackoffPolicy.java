package com.ednataxa.api.http;

import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Truncated exponential backoff with additive jitter. A server supplied Retry-After hint
 * raises the base delay but never beyond {@code maxBackoff}.
 */
public class BackoffPolicy {

    private static final Pattern DELTA_SECONDS = Pattern.compile("\\d{1,9}");

    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Duration maxBackoff;
    private final double multiplier;
    private final double jitter;
    private final Duration maxRetryBudget;

    public BackoffPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff,
                         double multiplier, double jitter, Duration maxRetryBudget) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.initialBackoff = initialBackoff;
        this.maxBackoff = maxBackoff;
        this.multiplier = multiplier;
        this.jitter = jitter;
        this.maxRetryBudget = maxRetryBudget;
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public RetryBudget newBudget() {
        return new RetryBudget(maxRetryBudget);
    }

    /**
     * Delay to wait after the given failed attempt (1-based).
     */
    public Duration delayAfter(int attempt, Optional<String> retryAfter) {
        long maxMs = maxBackoff.toMillis();
        double exp = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long baseMs = (long) Math.min(exp, maxMs);
        long hintMs = retryAfter.map(BackoffPolicy::parseRetryAfterMs).orElse(0L);
        baseMs = Math.min(Math.max(baseMs, hintMs), maxMs);
        long jitterMs = 0L;
        long bound = (long) (baseMs * jitter);
        if (bound > 0) {
            jitterMs = ThreadLocalRandom.current().nextLong(bound + 1);
        }
        return Duration.ofMillis(Math.min(baseMs + jitterMs, maxMs));
    }

    static long parseRetryAfterMs(String value) {
        String trimmed = value.trim();
        if (DELTA_SECONDS.matcher(trimmed).matches()) {
            return Long.parseLong(trimmed) * 1000L;
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            return Math.max(0L, Duration.between(ZonedDateTime.now(at.getZone()), at).toMillis());
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }

    /**
     * Total wait allowance for one lineage key across all of its remote calls.
     */
    public static final class RetryBudget {

        private long remainingMs;

        RetryBudget(Duration total) {
            this.remainingMs = total == null ? Long.MAX_VALUE : total.toMillis();
        }

        public synchronized boolean tryConsume(Duration delay) {
            long ms = delay.toMillis();
            if (ms > remainingMs) {
                return false;
            }
            remainingMs -= ms;
            return true;
        }
    }
}
