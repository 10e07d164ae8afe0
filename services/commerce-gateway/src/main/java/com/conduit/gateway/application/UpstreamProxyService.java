package com.conduit.gateway.application;

import com.conduit.client.CancellationToken;
import com.conduit.client.TenantKey;
import com.conduit.client.UpstreamRequest;
import com.conduit.client.UpstreamResponse;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.domain.Identifiers;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Forwards admin API calls for an installed shop through the tenant's pooled client.
 *
 * <p>Each call is bounded by the configured request deadline, which covers rate-limit waits and
 * retry backoff as well as the upstream I/O.
 */
@Service
public class UpstreamProxyService {

    private static final Logger log = LoggerFactory.getLogger(UpstreamProxyService.class);

    private final TenantClientResolver clientResolver;
    private final ShopService shopService;
    private final Duration requestDeadline;

    public UpstreamProxyService(
            TenantClientResolver clientResolver, ShopService shopService, ConduitProperties properties) {
        this.clientResolver = clientResolver;
        this.shopService = shopService;
        this.requestDeadline = properties.upstream().requestDeadline();
    }

    public UpstreamResponse<String> forward(
            TenantKey tenantKey, String shopDomain, String method, String path, String query, String body) {
        Identifiers.requireShopDomain(shopDomain);
        var client = clientResolver.clientFor(tenantKey);
        String accessToken = shopService.accessToken(tenantKey, shopDomain);
        var request = new UpstreamRequest(method, shopDomain, path, query, body, accessToken);
        log.debug("Forwarding {} for tenant {}", request, tenantKey);
        return client.execute(request, CancellationToken.withTimeout(requestDeadline));
    }
}
