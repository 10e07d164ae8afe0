package com.conduit.gateway.domain;

import com.conduit.client.TenantKey;
import java.time.Instant;
import java.util.List;

/**
 * A shop that installed a tenant's app, with its encrypted access token.
 *
 * @param shopDomain upstream shop
 * @param tenantKey tenant whose app the shop installed
 * @param encryptedAccessToken encrypted OAuth access token
 * @param scopes granted scopes
 * @param installedAt first install
 * @param updatedAt last token change
 */
public record ShopRecord(
        String shopDomain,
        TenantKey tenantKey,
        String encryptedAccessToken,
        List<String> scopes,
        Instant installedAt,
        Instant updatedAt) {

    public ShopRecord {
        if (shopDomain == null || shopDomain.isBlank()) {
            throw new IllegalArgumentException("shopDomain must not be null or blank");
        }
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
        if (encryptedAccessToken == null || encryptedAccessToken.isBlank()) {
            throw new IllegalArgumentException("encryptedAccessToken must not be null or blank");
        }
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
    }
}
