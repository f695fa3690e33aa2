package com.flowkeeper.core.substrate;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry schedule applied to an activity invocation.
 * <p>
 * The delay before attempt {@code n} (n &gt;= 2) is
 * {@code min(initialInterval * backoffCoefficient^(n-2), maximumInterval)}.
 *
 * @param maximumAttempts    total attempts including the first one (at least 1)
 * @param backoffCoefficient multiplier applied to the delay after every failed attempt
 * @param initialInterval    delay before the second attempt
 * @param maximumInterval    upper bound for any single delay
 */
public record RetryPolicy(
    int maximumAttempts,
    double backoffCoefficient,
    Duration initialInterval,
    Duration maximumInterval
) {

    public RetryPolicy {
        if (maximumAttempts < 1) {
            throw new IllegalArgumentException("maximumAttempts must be >= 1, got " + maximumAttempts);
        }
        if (backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("backoffCoefficient must be >= 1.0, got " + backoffCoefficient);
        }
        initialInterval = Objects.requireNonNullElse(initialInterval, Duration.ofSeconds(1));
        maximumInterval = Objects.requireNonNullElse(maximumInterval, initialInterval.multipliedBy(100));
    }

    /** Single attempt, no retries. Used for fire-and-forget event emission. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, 1.0, Duration.ZERO, Duration.ZERO);
    }

    public static RetryPolicy exponential(int maximumAttempts, double backoffCoefficient) {
        return new RetryPolicy(maximumAttempts, backoffCoefficient, Duration.ofSeconds(1), Duration.ofSeconds(100));
    }

    /**
     * Delay to wait before the given attempt number.
     *
     * @param attempt 1-based attempt number
     * @return {@link Duration#ZERO} for the first attempt
     */
    public Duration delayBeforeAttempt(int attempt) {
        if (attempt <= 1) {
            return Duration.ZERO;
        }
        double factor = Math.pow(backoffCoefficient, attempt - 2);
        double millis = initialInterval.toMillis() * factor;
        long capped = (long) Math.min(millis, maximumInterval.toMillis());
        return Duration.ofMillis(capped);
    }
}
