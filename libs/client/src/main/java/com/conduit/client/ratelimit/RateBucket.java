package com.conduit.client.ratelimit;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Token state of one upstream account.
 * <p>
 * Tokens are fractional and always within {@code [0, maxTokens]}. Refill is linear at
 * {@code maxTokens / window} and is computed lazily on each access. All methods take the
 * bucket's own lock and never block while holding it.
 */
final class RateBucket {

    private final ReentrantLock lock = new ReentrantLock();
    private final long windowNanos;
    private double tokens;
    private double maxTokens;
    private long lastRefillNanos;

    RateBucket(int maxTokens, long windowNanos, long nowNanos) {
        this.maxTokens = maxTokens;
        this.tokens = maxTokens;
        this.windowNanos = windowNanos;
        this.lastRefillNanos = nowNanos;
    }

    /**
     * Takes one token if available.
     *
     * @return 0 when a token was taken, otherwise the nanoseconds until the next token
     */
    long tryAcquire(long nowNanos) {
        lock.lock();
        try {
            refill(nowNanos);
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return 0L;
            }
            double nanosPerToken = windowNanos / maxTokens;
            return Math.max(1L, (long) Math.ceil((1.0 - tokens) * nanosPerToken));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites the local estimate with the provider's authoritative counters.
     */
    void reconcile(int used, int limit, long nowNanos) {
        lock.lock();
        try {
            maxTokens = limit;
            tokens = Math.max(0, limit - used);
            lastRefillNanos = nowNanos;
        } finally {
            lock.unlock();
        }
    }

    double available(long nowNanos) {
        lock.lock();
        try {
            refill(nowNanos);
            return tokens;
        } finally {
            lock.unlock();
        }
    }

    double maxTokens() {
        lock.lock();
        try {
            return maxTokens;
        } finally {
            lock.unlock();
        }
    }

    private void refill(long nowNanos) {
        long elapsed = nowNanos - lastRefillNanos;
        if (elapsed <= 0) {
            return;
        }
        tokens = Math.min(maxTokens, tokens + elapsed * (maxTokens / windowNanos));
        lastRefillNanos = nowNanos;
    }
}
