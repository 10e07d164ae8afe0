package com.conduit.gateway.infrastructure.upstream;

import com.conduit.client.CommerceApi;
import com.conduit.client.TenantCredentials;
import com.conduit.client.UpstreamRequest;
import com.conduit.client.UpstreamResponse;
import com.fasterxml.jackson.databind.JsonNode;
import java.net.URI;
import java.util.List;
import java.util.Map;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * {@link CommerceApi} over HTTPS with Spring's {@link RestTemplate}.
 *
 * <p>Admin calls go to {@code https://{shop}/admin/api/{version}/{path}} with the shop's access
 * token in {@value #ACCESS_TOKEN_HEADER}. Error statuses are returned as responses so the retry
 * executor can classify them; only I/O failures propagate.
 */
public class RestCommerceApi implements CommerceApi {

    static final String ACCESS_TOKEN_HEADER = "X-Shopify-Access-Token";

    private final RestTemplate restTemplate;
    private final String apiVersion;
    private final TenantCredentials credentials;

    public RestCommerceApi(RestTemplate restTemplate, String apiVersion, TenantCredentials credentials) {
        this.restTemplate = restTemplate;
        this.apiVersion = apiVersion;
        this.credentials = credentials;
    }

    @Override
    public String authorizationUrl(String shopDomain, List<String> scopes, String redirectUri, String state) {
        return UriComponentsBuilder.newInstance()
                .scheme("https")
                .host(shopDomain)
                .path("/admin/oauth/authorize")
                .queryParam("client_id", credentials.apiKey())
                .queryParam("scope", String.join(",", scopes == null ? List.of() : scopes))
                .queryParam("redirect_uri", redirectUri)
                .queryParam("state", state)
                .encode()
                .toUriString();
    }

    @Override
    public String exchangeToken(String shopDomain, String code) {
        URI uri = URI.create("https://" + shopDomain + "/admin/oauth/access_token");
        Map<String, String> body = Map.of(
                "client_id", credentials.apiKey(),
                "client_secret", credentials.apiSecret(),
                "code", code);
        JsonNode response = restTemplate.postForObject(uri, body, JsonNode.class);
        JsonNode token = response == null ? null : response.get("access_token");
        if (token == null || token.asText().isBlank()) {
            throw new RestClientException("Token exchange with %s returned no access_token".formatted(shopDomain));
        }
        return token.asText();
    }

    @Override
    public UpstreamResponse<String> send(UpstreamRequest request) {
        HttpHeaders headers = new HttpHeaders();
        headers.set(ACCESS_TOKEN_HEADER, request.accessToken());
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        if (request.body() != null) {
            headers.setContentType(MediaType.APPLICATION_JSON);
        }
        HttpEntity<String> entity = new HttpEntity<>(request.body(), headers);

        try {
            ResponseEntity<String> response =
                    restTemplate.exchange(adminUri(request), HttpMethod.valueOf(request.method()), entity, String.class);
            return new UpstreamResponse<>(
                    response.getStatusCode().value(), response.getHeaders().toSingleValueMap(), response.getBody());
        } catch (HttpStatusCodeException e) {
            HttpHeaders responseHeaders = e.getResponseHeaders();
            return new UpstreamResponse<>(
                    e.getStatusCode().value(),
                    responseHeaders == null ? Map.of() : responseHeaders.toSingleValueMap(),
                    e.getResponseBodyAsString());
        }
    }

    URI adminUri(UpstreamRequest request) {
        String query = request.query() == null || request.query().isBlank() ? "" : "?" + request.query();
        return URI.create("https://%s/admin/api/%s/%s%s".formatted(
                request.shopDomain(), apiVersion, request.path(), query));
    }
}
