package com.conduit.client;

/**
 * Decrypted upstream credentials of one tenant.
 * <p>
 * {@code toString()} masks every secret, so instances can appear in log statements safely.
 *
 * @param apiKey        upstream app key
 * @param apiSecret     upstream app secret (plaintext)
 * @param webhookSecret dedicated webhook signing secret, nullable
 */
public record TenantCredentials(String apiKey, String apiSecret, String webhookSecret) {

    public TenantCredentials {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("apiKey must not be null or blank");
        }
        if (apiSecret == null || apiSecret.isBlank()) {
            throw new IllegalArgumentException("apiSecret must not be null or blank");
        }
        if (webhookSecret != null && webhookSecret.isBlank()) {
            webhookSecret = null;
        }
    }

    public static TenantCredentials of(String apiKey, String apiSecret) {
        return new TenantCredentials(apiKey, apiSecret, null);
    }

    /**
     * Secret the provider signs webhook deliveries with: the dedicated webhook secret when
     * configured, the api secret otherwise.
     */
    public String webhookSigningSecret() {
        return webhookSecret != null ? webhookSecret : apiSecret;
    }

    @Override
    public String toString() {
        return "TenantCredentials[apiKey=%s, apiSecret=****, webhookSecret=%s]"
                .formatted(apiKey, webhookSecret == null ? "none" : "****");
    }
}
