package com.conduit.client.ratelimit;

import com.conduit.client.CancellationToken;
import com.conduit.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-account token bucket in front of every outbound upstream call.
 * <p>
 * The account key is the upstream account (the shop domain): tenants sharing one shop share its
 * bucket. Buckets are created on first use and kept for the process lifetime. Creating buckets for
 * different accounts never serializes, and each bucket has its own lock.
 * <p>
 * Waiting never spins. Each time a caller finds the bucket empty it sleeps once, for the time
 * until the next token but at least {@code minWait}, then checks again.
 */
public class RateLimiter {

    /** Response header carrying the provider's {@code used/limit} counters. */
    public static final String CALL_LIMIT_HEADER = "X-Shopify-Shop-Api-Call-Limit";

    private static final Logger log = LoggerFactory.getLogger(RateLimiter.class);
    private static final Pattern CALL_LIMIT = Pattern.compile("^\\s*(\\d+)\\s*/\\s*(\\d+)\\s*$");

    private final RateLimiterConfig config;
    private final ConcurrentMap<String, RateBucket> buckets = new ConcurrentHashMap<>();
    private final Counter waits;
    private final Counter rejections;
    private final Timer waitTime;

    public RateLimiter(RateLimiterConfig config, MetricFactory metrics) {
        if (config == null) {
            throw new IllegalArgumentException("config must not be null");
        }
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.config = config;
        this.waits = metrics.counter("conduit.ratelimit.waits", "Calls that had to wait for a token");
        this.rejections = metrics.counter("conduit.ratelimit.rejections", "Calls rejected after the maximum wait");
        this.waitTime = metrics.timer("conduit.ratelimit.wait", "Time spent waiting for a token");
    }

    /**
     * Blocks until a token for {@code accountKey} is available.
     *
     * @throws com.conduit.client.OperationCancelledException if the token fires while waiting
     * @throws RateLimitExceededException if the wait would exceed the configured maximum
     */
    public void acquire(String accountKey, CancellationToken cancellation) {
        RateBucket bucket = bucket(accountKey);
        long start = System.nanoTime();
        boolean waited = false;
        while (true) {
            cancellation.throwIfCancelled();
            long now = System.nanoTime();
            long untilNextToken = bucket.tryAcquire(now);
            if (untilNextToken == 0L) {
                if (waited) {
                    waitTime.record(Duration.ofNanos(System.nanoTime() - start));
                }
                return;
            }
            long sleepNanos = Math.max(untilNextToken, config.minWait().toNanos());
            if (now - start + sleepNanos > config.maxWait().toNanos()) {
                rejections.increment();
                log.warn("Rate limit wait for account {} would exceed {} ms, rejecting",
                        accountKey, config.maxWait().toMillis());
                throw new RateLimitExceededException(accountKey, Duration.ofNanos(sleepNanos));
            }
            if (!waited) {
                waits.increment();
                waited = true;
            }
            log.debug("Rate limited on account {}, waiting {} ms", accountKey, sleepNanos / 1_000_000);
            cancellation.sleep(Duration.ofNanos(sleepNanos));
        }
    }

    /**
     * Reconciles the bucket with the provider's counters: tokens become {@code max(0, limit - used)}
     * and the bucket's size becomes {@code limit}. Non-positive limits are ignored.
     */
    public void updateFromResponse(String accountKey, int used, int limit) {
        if (limit <= 0 || used < 0) {
            return;
        }
        bucket(accountKey).reconcile(used, limit, System.nanoTime());
    }

    /**
     * Parses a {@code used/limit} call-limit header (e.g. {@code "12/40"}) and reconciles the
     * bucket. Absent or malformed values leave the bucket unchanged.
     *
     * @return whether the header was applied
     */
    public boolean updateFromHeader(String accountKey, String headerValue) {
        if (headerValue == null) {
            return false;
        }
        Matcher m = CALL_LIMIT.matcher(headerValue);
        if (!m.matches()) {
            log.debug("Ignoring malformed call-limit header '{}' for account {}", headerValue, accountKey);
            return false;
        }
        int used;
        int limit;
        try {
            used = Integer.parseInt(m.group(1));
            limit = Integer.parseInt(m.group(2));
        } catch (NumberFormatException e) {
            return false;
        }
        if (limit <= 0) {
            return false;
        }
        updateFromResponse(accountKey, used, limit);
        return true;
    }

    /**
     * Current token estimate for an account, after refill.
     */
    public double remainingTokens(String accountKey) {
        return bucket(accountKey).available(System.nanoTime());
    }

    /**
     * Current bucket size for an account; changes when the provider reports a different limit.
     */
    public double maxTokens(String accountKey) {
        return bucket(accountKey).maxTokens();
    }

    public int bucketCount() {
        return buckets.size();
    }

    public RateLimiterConfig config() {
        return config;
    }

    private RateBucket bucket(String accountKey) {
        if (accountKey == null || accountKey.isBlank()) {
            throw new IllegalArgumentException("accountKey must not be null or blank");
        }
        return buckets.computeIfAbsent(accountKey,
                k -> new RateBucket(config.maxRequests(), config.window().toNanos(), System.nanoTime()));
    }
}
