package com.conduit.client.ratelimit;

import java.time.Duration;

/**
 * Bucket sizing and wait bounds for {@link RateLimiter}.
 * <p>
 * The provider allows about 40 calls per account per minute; the default of 35 leaves headroom
 * for clock skew and concurrent callers.
 *
 * @param maxRequests tokens per fresh bucket
 * @param window      time for an empty bucket to refill completely
 * @param minWait     floor for a single sleep while waiting for a token
 * @param maxWait     longest a caller may wait before the call is rejected
 */
public record RateLimiterConfig(int maxRequests, Duration window, Duration minWait, Duration maxWait) {

    public static final int DEFAULT_MAX_REQUESTS = 35;
    public static final Duration DEFAULT_WINDOW = Duration.ofMinutes(1);
    public static final Duration DEFAULT_MIN_WAIT = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX_WAIT = Duration.ofSeconds(60);

    public RateLimiterConfig {
        if (maxRequests <= 0) {
            throw new IllegalArgumentException("maxRequests must be positive");
        }
        if (window == null || window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("window must be positive");
        }
        if (minWait == null || minWait.isNegative()) {
            throw new IllegalArgumentException("minWait must not be null or negative");
        }
        if (maxWait == null || maxWait.isNegative()) {
            throw new IllegalArgumentException("maxWait must not be null or negative");
        }
    }

    public static RateLimiterConfig defaults() {
        return new RateLimiterConfig(DEFAULT_MAX_REQUESTS, DEFAULT_WINDOW, DEFAULT_MIN_WAIT, DEFAULT_MAX_WAIT);
    }
}
