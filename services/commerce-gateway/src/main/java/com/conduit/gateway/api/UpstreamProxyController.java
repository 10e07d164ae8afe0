package com.conduit.gateway.api;

import com.conduit.client.TenantKey;
import com.conduit.client.UpstreamResponse;
import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.gateway.application.UpstreamProxyService;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.domain.Identifiers;
import com.conduit.observability.CorrelationContextHolder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RestController;

/**
 * Pass-through to a shop's admin API.
 *
 * <p>{@code /api/v1/tenants/{p}/{e}/shops/{shop}/admin/products.json} is sent to
 * {@code https://{shop}/admin/api/{version}/products.json}. JSON answers are wrapped as
 * {@code {"data": ..., "meta": {"path": ...}}}; anything else is returned as text. The upstream
 * status and call-limit header are passed on.
 */
@RestController
public class UpstreamProxyController {

    private static final Logger log = LoggerFactory.getLogger(UpstreamProxyController.class);

    private final UpstreamProxyService proxyService;
    private final ConduitProperties properties;
    private final ObjectMapper objectMapper;

    public UpstreamProxyController(
            UpstreamProxyService proxyService, ConduitProperties properties, ObjectMapper objectMapper) {
        this.proxyService = proxyService;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @RequestMapping(
            value = "/api/v1/tenants/{projectId}/{environment}/shops/{shopDomain}/admin/**",
            method = {RequestMethod.GET, RequestMethod.POST, RequestMethod.PUT, RequestMethod.DELETE})
    public ResponseEntity<?> forward(
            @PathVariable String projectId,
            @PathVariable String environment,
            @PathVariable String shopDomain,
            @RequestBody(required = false) String body,
            HttpServletRequest request) {
        TenantKey tenantKey = Identifiers.tenantKey(projectId, environment, properties.defaultEnvironment());
        Identifiers.requireShopDomain(shopDomain);
        CorrelationContextHolder.enrich(tenantKey.value(), shopDomain);

        String path = adminPath(request.getRequestURI(), shopDomain);
        UpstreamResponse<String> response = proxyService.forward(
                tenantKey, shopDomain, request.getMethod(), path, request.getQueryString(), body);

        ResponseEntity.BodyBuilder builder = ResponseEntity.status(response.status());
        response.header(RateLimiter.CALL_LIMIT_HEADER)
                .ifPresent(value -> builder.header(RateLimiter.CALL_LIMIT_HEADER, value));

        JsonNode json = parseJson(response.body());
        if (json == null) {
            return builder.contentType(MediaType.TEXT_PLAIN).body(response.body() == null ? "" : response.body());
        }
        ObjectNode wrapped = objectMapper.createObjectNode();
        wrapped.set("data", json);
        wrapped.putObject("meta").put("path", path);
        return builder.contentType(MediaType.APPLICATION_JSON).body(wrapped);
    }

    static String adminPath(String requestUri, String shopDomain) {
        String marker = "/shops/" + shopDomain + "/admin/";
        int start = requestUri.indexOf(marker);
        return start < 0 ? "" : requestUri.substring(start + marker.length());
    }

    private JsonNode parseJson(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Upstream body is not JSON, returning it as text");
            return null;
        }
    }
}
