package com.conduit.gateway.api;

import com.conduit.client.TenantCredentials;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of a credentials update.
 *
 * @param apiKey upstream app key
 * @param apiSecret upstream app secret
 * @param webhookSecret dedicated webhook signing secret, optional
 */
public record CredentialsRequest(@NotBlank String apiKey, @NotBlank String apiSecret, String webhookSecret) {

    public TenantCredentials toCredentials() {
        return new TenantCredentials(apiKey, apiSecret, webhookSecret);
    }

    @Override
    public String toString() {
        return "CredentialsRequest[apiKey=" + apiKey + ", apiSecret=***]";
    }
}
