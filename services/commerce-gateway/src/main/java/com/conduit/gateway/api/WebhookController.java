package com.conduit.gateway.api;

import com.conduit.client.TenantKey;
import com.conduit.gateway.application.WebhookIngestionService;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.domain.Identifiers;
import com.conduit.webhook.DispatchResult;
import java.util.Map;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Webhook intake. The body is bound as raw bytes so the signature is checked over exactly what
 * the provider sent.
 */
@RestController
@RequestMapping("/webhooks")
public class WebhookController {

    public static final String SIGNATURE_HEADER = "X-Shopify-Hmac-Sha256";
    public static final String TOPIC_HEADER = "X-Shopify-Topic";
    public static final String SHOP_DOMAIN_HEADER = "X-Shopify-Shop-Domain";

    private final WebhookIngestionService ingestionService;
    private final ConduitProperties properties;

    public WebhookController(WebhookIngestionService ingestionService, ConduitProperties properties) {
        this.ingestionService = ingestionService;
        this.properties = properties;
    }

    @PostMapping(value = "/{projectId}/{environment}", consumes = MediaType.ALL_VALUE)
    public Map<String, Object> receive(
            @PathVariable String projectId,
            @PathVariable String environment,
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(name = TOPIC_HEADER, required = false) String topic,
            @RequestHeader(name = SHOP_DOMAIN_HEADER, required = false) String shopDomain) {
        TenantKey tenantKey = Identifiers.tenantKey(projectId, environment, properties.defaultEnvironment());
        DispatchResult result = ingestionService.ingest(
                tenantKey, body == null ? new byte[0] : body, signature, topic, shopDomain);
        return Map.of("received", true, "handlers", result.matched());
    }

    @PostMapping(value = "/{projectId}", consumes = MediaType.ALL_VALUE)
    public Map<String, Object> receiveDefaultEnvironment(
            @PathVariable String projectId,
            @RequestBody(required = false) byte[] body,
            @RequestHeader(name = SIGNATURE_HEADER, required = false) String signature,
            @RequestHeader(name = TOPIC_HEADER, required = false) String topic,
            @RequestHeader(name = SHOP_DOMAIN_HEADER, required = false) String shopDomain) {
        return receive(projectId, null, body, signature, topic, shopDomain);
    }
}
