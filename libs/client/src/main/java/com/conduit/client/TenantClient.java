package com.conduit.client;

import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.client.retry.RetryExecutor;
import com.conduit.client.retry.RetryPolicy;

import java.util.List;

/**
 * Authenticated upstream client of one tenant, as handed out by {@link TenantClientPool}.
 * <p>
 * Every {@link #execute} attempt takes a rate-limit token for the target account, performs the
 * call and reconciles the account's bucket from the call-limit header. Attempts are wrapped by
 * the shared retry executor.
 */
public final class TenantClient {

    private final TenantKey tenantKey;
    private final TenantCredentials credentials;
    private final CommerceApi api;
    private final RateLimiter rateLimiter;
    private final RetryExecutor retryExecutor;
    private final RetryPolicy retryPolicy;

    TenantClient(TenantKey tenantKey, TenantCredentials credentials, CommerceApi api,
                 RateLimiter rateLimiter, RetryExecutor retryExecutor, RetryPolicy retryPolicy) {
        this.tenantKey = tenantKey;
        this.credentials = credentials;
        this.api = api;
        this.rateLimiter = rateLimiter;
        this.retryExecutor = retryExecutor;
        this.retryPolicy = retryPolicy;
    }

    public TenantKey tenantKey() {
        return tenantKey;
    }

    /**
     * Credentials this client was built with. May be older than the stored ones until the
     * tenant's client is invalidated.
     */
    public TenantCredentials credentials() {
        return credentials;
    }

    public String authorizationUrl(String shopDomain, List<String> scopes, String redirectUri, String state) {
        return api.authorizationUrl(shopDomain, scopes, redirectUri, state);
    }

    /**
     * Exchanges an OAuth code for a shop access token. Counts against the shop's rate limit.
     */
    public String exchangeToken(String shopDomain, String code, CancellationToken cancellation) {
        rateLimiter.acquire(shopDomain, cancellation);
        return api.exchangeToken(shopDomain, code);
    }

    /**
     * Sends a request through the rate limiter and the retry executor.
     *
     * @param accountKey   rate-limit account, normally the request's shop domain
     * @param cancellation caller's cancellation and deadline
     * @param request      the request to send
     * @return the first non-retryable response
     */
    public UpstreamResponse<String> execute(String accountKey, CancellationToken cancellation, UpstreamRequest request) {
        return retryExecutor.execute(() -> {
            rateLimiter.acquire(accountKey, cancellation);
            UpstreamResponse<String> response = api.send(request);
            response.header(RateLimiter.CALL_LIMIT_HEADER)
                    .ifPresent(value -> rateLimiter.updateFromHeader(accountKey, value));
            return response;
        }, retryPolicy, cancellation);
    }

    /**
     * Same as {@link #execute(String, CancellationToken, UpstreamRequest)} with the request's
     * shop as the rate-limit account.
     */
    public UpstreamResponse<String> execute(UpstreamRequest request, CancellationToken cancellation) {
        return execute(request.shopDomain(), cancellation, request);
    }
}
