package com.conduit.client;

/**
 * One call against a shop's admin API.
 *
 * @param method      HTTP method (GET, POST, PUT, DELETE)
 * @param shopDomain  shop the call targets, also the rate-limit account
 * @param path        resource path below the versioned admin root, e.g. {@code products.json}
 * @param query       raw query string without {@code ?}, nullable
 * @param body        JSON body, nullable
 * @param accessToken shop access token obtained through the OAuth exchange
 */
public record UpstreamRequest(
        String method,
        String shopDomain,
        String path,
        String query,
        String body,
        String accessToken
) {

    public UpstreamRequest {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("method must not be null or blank");
        }
        if (shopDomain == null || shopDomain.isBlank()) {
            throw new IllegalArgumentException("shopDomain must not be null or blank");
        }
        if (path == null) {
            throw new IllegalArgumentException("path must not be null");
        }
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be null or blank");
        }
        method = method.toUpperCase();
        while (path.startsWith("/")) {
            path = path.substring(1);
        }
    }

    public static UpstreamRequest get(String shopDomain, String path, String accessToken) {
        return new UpstreamRequest("GET", shopDomain, path, null, null, accessToken);
    }

    @Override
    public String toString() {
        return "UpstreamRequest[%s %s/%s]".formatted(method, shopDomain, path);
    }
}
