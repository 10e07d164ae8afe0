package com.conduit.gateway.domain;

import com.conduit.client.TenantKey;
import java.time.Instant;

/**
 * Tenant credentials as persisted: the secrets are ciphertext produced by the credential cipher.
 *
 * @param tenantKey owning tenant
 * @param apiKey upstream app key (not secret)
 * @param encryptedApiSecret encrypted app secret
 * @param encryptedWebhookSecret encrypted dedicated webhook secret, nullable
 * @param createdAt first save
 * @param updatedAt last save
 */
public record StoredCredentials(
        TenantKey tenantKey,
        String apiKey,
        String encryptedApiSecret,
        String encryptedWebhookSecret,
        Instant createdAt,
        Instant updatedAt) {

    public StoredCredentials {
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be null or blank");
        }
        if (encryptedApiSecret == null || encryptedApiSecret.isBlank()) {
            throw new IllegalArgumentException("encryptedApiSecret must not be null or blank");
        }
    }

    public boolean hasWebhookSecret() {
        return encryptedWebhookSecret != null;
    }
}
