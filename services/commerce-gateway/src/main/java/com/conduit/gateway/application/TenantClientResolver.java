package com.conduit.gateway.application;

import com.conduit.client.TenantClient;
import com.conduit.client.TenantClientPool;
import com.conduit.client.TenantKey;
import org.springframework.stereotype.Component;

/** Looks up a tenant's stored credentials and hands out its pooled client. */
@Component
public class TenantClientResolver {

    private final TenantCredentialsService credentialsService;
    private final TenantClientPool clientPool;

    public TenantClientResolver(TenantCredentialsService credentialsService, TenantClientPool clientPool) {
        this.credentialsService = credentialsService;
        this.clientPool = clientPool;
    }

    /**
     * @throws com.conduit.gateway.domain.TenantNotConfiguredException if the tenant has no credentials
     * @throws com.conduit.client.ClientConstructionException if the client cannot be built
     */
    public TenantClient clientFor(TenantKey tenantKey) {
        return clientPool.getClient(tenantKey, credentialsService.resolve(tenantKey));
    }
}
