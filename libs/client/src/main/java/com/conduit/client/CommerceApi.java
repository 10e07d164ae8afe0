package com.conduit.client;

import java.util.List;

/**
 * Upstream call surface of one authenticated app.
 * <p>
 * Implementations live at the edge (an HTTP adapter in the gateway); the pool only caches them.
 * Resource calls are generic: requests and responses carry opaque JSON.
 */
public interface CommerceApi {

    /**
     * Builds the URL a merchant is sent to for installing the app on a shop.
     */
    String authorizationUrl(String shopDomain, List<String> scopes, String redirectUri, String state);

    /**
     * Exchanges an OAuth authorization code for a shop access token.
     */
    String exchangeToken(String shopDomain, String code);

    /**
     * Performs one request against the admin API. Non-2xx answers are returned, not thrown.
     */
    UpstreamResponse<String> send(UpstreamRequest request);
}
