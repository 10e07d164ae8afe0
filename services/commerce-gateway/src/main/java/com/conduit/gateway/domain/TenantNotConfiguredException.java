package com.conduit.gateway.domain;

import com.conduit.client.TenantKey;

/** Thrown when a tenant has no stored upstream credentials. */
public class TenantNotConfiguredException extends RuntimeException {

    private final TenantKey tenantKey;

    public TenantNotConfiguredException(TenantKey tenantKey) {
        super("Tenant '%s' has no upstream credentials configured".formatted(tenantKey));
        this.tenantKey = tenantKey;
    }

    public TenantKey tenantKey() {
        return tenantKey;
    }
}
