package com.eainde.patientqa.pipeline;

import java.time.Duration;

/**
 * Bounded retry with exponential backoff.
 *
 * @param maxAttempts    total attempts including the first, at least 1
 * @param initialBackoff wait before the second attempt
 * @param multiplier     growth factor between consecutive waits
 * @param maxBackoff     upper bound of a single wait
 * @param callTimeout    per-call timeout; zero or null disables it
 */
public record RetryPolicy(
        int maxAttempts,
        Duration initialBackoff,
        double multiplier,
        Duration maxBackoff,
        Duration callTimeout
) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (multiplier < 1.0) throw new IllegalArgumentException("multiplier must be >= 1");
        initialBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null ? initialBackoff : maxBackoff;
    }

    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, 1.0, Duration.ZERO, null);
    }

    /**
     * Wait before attempt {@code attempt + 1}, where {@code attempt} is 1-based.
     */
    public Duration backoffAfter(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }

    public boolean hasCallTimeout() {
        return callTimeout != null && !callTimeout.isZero() && !callTimeout.isNegative();
    }
}
