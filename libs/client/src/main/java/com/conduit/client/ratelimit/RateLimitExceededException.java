package com.conduit.client.ratelimit;

import java.time.Duration;

/**
 * Thrown when a caller would have to wait longer than the limiter's maximum wait for a token.
 */
public class RateLimitExceededException extends RuntimeException {

    private final String accountKey;
    private final Duration retryAfter;

    public RateLimitExceededException(String accountKey, Duration retryAfter) {
        super("Rate limit exceeded for account '%s', retry after %d ms"
                .formatted(accountKey, retryAfter.toMillis()));
        this.accountKey = accountKey;
        this.retryAfter = retryAfter;
    }

    public String accountKey() {
        return accountKey;
    }

    /**
     * Estimated wait until a token becomes available.
     */
    public Duration retryAfter() {
        return retryAfter;
    }
}
