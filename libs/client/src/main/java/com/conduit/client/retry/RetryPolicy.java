package com.conduit.client.retry;

import java.time.Duration;
import java.util.Set;

/**
 * Immutable backoff settings shared by every tenant client.
 *
 * @param maxRetries        retries after the first attempt; total attempts are {@code maxRetries + 1}
 * @param initialDelay      wait before the first retry
 * @param maxDelay          cap for any single wait
 * @param backoffFactor     multiplier applied to the wait after every retry
 * @param retryableStatuses HTTP statuses worth retrying
 */
public record RetryPolicy(
        int maxRetries,
        Duration initialDelay,
        Duration maxDelay,
        double backoffFactor,
        Set<Integer> retryableStatuses
) {

    public static final Set<Integer> DEFAULT_RETRYABLE_STATUSES = Set.of(429, 500, 502, 503, 504);

    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (initialDelay == null || initialDelay.isNegative()) {
            throw new IllegalArgumentException("initialDelay must not be null or negative");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be null or below initialDelay");
        }
        if (backoffFactor < 1.0) {
            throw new IllegalArgumentException("backoffFactor must be at least 1.0");
        }
        retryableStatuses = retryableStatuses == null ? Set.of() : Set.copyOf(retryableStatuses);
    }

    /**
     * 3 retries starting at 100 ms, doubling up to 5 s, on 429 and 5xx gateway statuses.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(100), Duration.ofSeconds(5), 2.0, DEFAULT_RETRYABLE_STATUSES);
    }

    public boolean isRetryableStatus(int status) {
        return retryableStatuses.contains(status);
    }

    /**
     * Wait that follows {@code current}: multiplied by the backoff factor, capped at {@code maxDelay}.
     */
    public Duration nextDelay(Duration current) {
        double next = current.toNanos() * backoffFactor;
        if (next >= maxDelay.toNanos()) {
            return maxDelay;
        }
        return Duration.ofNanos((long) next);
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }
}
