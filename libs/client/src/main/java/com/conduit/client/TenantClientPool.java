package com.conduit.client;

import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.client.retry.RetryExecutor;
import com.conduit.client.retry.RetryPolicy;
import com.conduit.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Caches one {@link TenantClient} per {@link TenantKey} and builds it at most once under
 * concurrent first use.
 * <p>
 * The first caller for a key installs a construction guard (a future) and builds the client;
 * concurrent callers for the same key wait on that guard and receive the same client or the same
 * {@link ClientConstructionException}. Callers for different keys never contend. Failures are not
 * cached.
 * <p>
 * A cached client is returned even when the caller passes different credentials. Rotation is an
 * explicit {@link #invalidateClient(TenantKey)}; there is no TTL.
 */
public class TenantClientPool {

    private static final Logger log = LoggerFactory.getLogger(TenantClientPool.class);

    private final ConcurrentMap<TenantKey, TenantClient> clients = new ConcurrentHashMap<>();
    private final ConcurrentMap<TenantKey, CompletableFuture<TenantClient>> inFlight = new ConcurrentHashMap<>();

    private final CommerceApiFactory apiFactory;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;
    private final Counter constructions;
    private final Counter constructionFailures;
    private final Counter invalidations;

    public TenantClientPool(CommerceApiFactory apiFactory, RateLimiter rateLimiter, RetryExecutor retryExecutor,
                            RetryPolicy retryPolicy, MetricFactory metrics) {
        if (apiFactory == null || rateLimiter == null || retryExecutor == null || retryPolicy == null || metrics == null) {
            throw new IllegalArgumentException("pool collaborators must not be null");
        }
        this.apiFactory = apiFactory;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
        this.constructions = metrics.counter("conduit.client.constructions", "Upstream clients built");
        this.constructionFailures = metrics.counter("conduit.client.construction.failures", "Failed client builds");
        this.invalidations = metrics.counter("conduit.client.invalidations", "Cached clients invalidated");
    }

    /**
     * Returns the tenant's cached client, building it if needed.
     *
     * @throws IllegalArgumentException    if the key or credentials are missing
     * @throws ClientConstructionException if building the client fails
     */
    public TenantClient getClient(TenantKey tenantKey, TenantCredentials credentials) {
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
        if (credentials == null) {
            throw new IllegalArgumentException("credentials must not be null");
        }

        TenantClient cached = clients.get(tenantKey);
        if (cached != null) {
            return cached;
        }

        CompletableFuture<TenantClient> guard = new CompletableFuture<>();
        CompletableFuture<TenantClient> existing = inFlight.putIfAbsent(tenantKey, guard);
        if (existing != null) {
            return await(existing);
        }

        // the previous guard may have been released between the cache miss and putIfAbsent
        TenantClient raced = clients.get(tenantKey);
        if (raced != null) {
            inFlight.remove(tenantKey, guard);
            guard.complete(raced);
            return raced;
        }

        TenantClient client;
        try {
            client = construct(tenantKey, credentials);
        } catch (RuntimeException | Error e) {
            // release the guard so waiters fail and the next call retries
            inFlight.remove(tenantKey, guard);
            guard.completeExceptionally(e);
            throw e;
        }

        // cache only if no invalidation released our guard meanwhile
        inFlight.compute(tenantKey, (key, current) -> {
            if (current == guard) {
                clients.put(key, client);
                return null;
            }
            return current;
        });
        guard.complete(client);
        return client;
    }

    /**
     * Drops the tenant's cached client and construction guard. Idempotent. A construction in
     * flight still completes for its own callers but is not cached.
     */
    public void invalidateClient(TenantKey tenantKey) {
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
        boolean[] removed = new boolean[1];
        inFlight.compute(tenantKey, (key, current) -> {
            removed[0] = clients.remove(key) != null;
            return null;
        });
        if (removed[0]) {
            invalidations.increment();
            log.info("Invalidated upstream client for tenant {}", tenantKey);
        }
    }

    public boolean isCached(TenantKey tenantKey) {
        return clients.containsKey(tenantKey);
    }

    public int size() {
        return clients.size();
    }

    private TenantClient construct(TenantKey tenantKey, TenantCredentials credentials) {
        CommerceApi api;
        try {
            api = apiFactory.create(credentials);
        } catch (RuntimeException e) {
            constructionFailures.increment();
            log.error("Failed to create upstream client for tenant {}", tenantKey, e);
            throw new ClientConstructionException(tenantKey, e);
        }
        if (api == null) {
            constructionFailures.increment();
            log.error("Upstream client factory returned nothing for tenant {}", tenantKey);
            throw new ClientConstructionException(tenantKey, "factory returned no client");
        }
        constructions.increment();
        log.info("Created upstream client for tenant {}", tenantKey);
        return new TenantClient(tenantKey, credentials, api, rateLimiter, retryExecutor, retryPolicy);
    }

    private static TenantClient await(CompletableFuture<TenantClient> guard) {
        try {
            return guard.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ClientConstructionException cce) {
                throw cce;
            }
            if (e.getCause() instanceof Error error) {
                throw error;
            }
            throw e;
        }
    }
}
