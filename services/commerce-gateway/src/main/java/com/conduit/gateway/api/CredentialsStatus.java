package com.conduit.gateway.api;

import com.conduit.gateway.domain.StoredCredentials;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;

/** What the admin API reveals about a tenant's credentials. Secrets are never included. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CredentialsStatus(
        String tenantKey,
        boolean configured,
        String apiKey,
        Boolean hasWebhookSecret,
        Instant createdAt,
        Instant updatedAt) {

    static CredentialsStatus of(StoredCredentials stored) {
        return new CredentialsStatus(
                stored.tenantKey().value(),
                true,
                stored.apiKey(),
                stored.hasWebhookSecret(),
                stored.createdAt(),
                stored.updatedAt());
    }

    static CredentialsStatus notConfigured(String tenantKey) {
        return new CredentialsStatus(tenantKey, false, null, null, null, null);
    }
}
