package com.conduit.gateway.domain;

import com.conduit.client.TenantKey;

/** Thrown when a shop has not installed the tenant's app, or its token was removed. */
public class ShopNotFoundException extends RuntimeException {

    private final TenantKey tenantKey;
    private final String shopDomain;

    public ShopNotFoundException(TenantKey tenantKey, String shopDomain) {
        super("Shop '%s' is not installed for tenant '%s'".formatted(shopDomain, tenantKey));
        this.tenantKey = tenantKey;
        this.shopDomain = shopDomain;
    }

    public TenantKey tenantKey() {
        return tenantKey;
    }

    public String shopDomain() {
        return shopDomain;
    }
}
