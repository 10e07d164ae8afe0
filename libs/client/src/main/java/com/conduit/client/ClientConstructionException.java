package com.conduit.client;

/**
 * Thrown when the pool cannot build a client for a tenant. The failure is never cached: the next
 * request for the tenant tries again.
 */
public class ClientConstructionException extends RuntimeException {

    private final TenantKey tenantKey;

    public ClientConstructionException(TenantKey tenantKey, String reason) {
        super("Failed to create upstream client for tenant '%s': %s".formatted(tenantKey, reason));
        this.tenantKey = tenantKey;
    }

    public ClientConstructionException(TenantKey tenantKey, Throwable cause) {
        super("Failed to create upstream client for tenant '%s': %s"
                .formatted(tenantKey, cause.getMessage()), cause);
        this.tenantKey = tenantKey;
    }

    public TenantKey tenantKey() {
        return tenantKey;
    }
}
