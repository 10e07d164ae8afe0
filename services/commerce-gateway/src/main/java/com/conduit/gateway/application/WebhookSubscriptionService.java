package com.conduit.gateway.application;

import com.conduit.client.CancellationToken;
import com.conduit.client.OperationCancelledException;
import com.conduit.client.TenantClient;
import com.conduit.client.TenantKey;
import com.conduit.client.UpstreamRequest;
import com.conduit.client.UpstreamResponse;
import com.conduit.gateway.config.ConduitProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Registers the configured webhook topics on a shop so its deliveries reach
 * {@code /webhooks/{projectId}/{environment}}.
 *
 * <p>Each topic is created with its own {@code POST webhooks.json} through the tenant's pooled
 * client. A topic that fails is reported and the remaining topics are still attempted. A 422 is
 * the provider rejecting a duplicate address and counts as subscribed.
 */
@Service
public class WebhookSubscriptionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookSubscriptionService.class);

    static final String WEBHOOKS_PATH = "webhooks.json";
    private static final int ALREADY_SUBSCRIBED = 422;

    /**
     * @param subscribed topics the shop now delivers
     * @param failed topics the provider did not accept
     */
    public record SubscriptionResult(List<String> subscribed, List<String> failed) {

        public SubscriptionResult {
            subscribed = List.copyOf(subscribed);
            failed = List.copyOf(failed);
        }

        static SubscriptionResult skipped() {
            return new SubscriptionResult(List.of(), List.of());
        }
    }

    private final TenantClientResolver clientResolver;
    private final ConduitProperties.Webhooks settings;
    private final ObjectMapper objectMapper;

    public WebhookSubscriptionService(
            TenantClientResolver clientResolver, ConduitProperties properties, ObjectMapper objectMapper) {
        this.clientResolver = clientResolver;
        this.settings = properties.webhooks();
        this.objectMapper = objectMapper;
    }

    public SubscriptionResult subscribe(
            TenantKey tenantKey, String shopDomain, String accessToken, CancellationToken cancellation) {
        if (!settings.subscriptionsEnabled()) {
            log.warn("No webhook callback URL configured; shop {} was not subscribed to any topic", shopDomain);
            return SubscriptionResult.skipped();
        }
        TenantClient client = clientResolver.clientFor(tenantKey);
        String address = settings.callbackUrl(tenantKey);
        List<String> subscribed = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (String topic : settings.subscriptionTopics()) {
            var request = new UpstreamRequest(
                    "POST", shopDomain, WEBHOOKS_PATH, null, subscriptionBody(topic, address), accessToken);
            try {
                UpstreamResponse<String> response = client.execute(request, cancellation);
                if (response.isSuccessful() || response.status() == ALREADY_SUBSCRIBED) {
                    subscribed.add(topic);
                    log.info("Subscribed shop {} to {} (status {})", shopDomain, topic, response.status());
                } else {
                    failed.add(topic);
                    log.warn("Shop {} rejected the {} subscription with status {}", shopDomain, topic, response.status());
                }
            } catch (OperationCancelledException e) {
                throw e;
            } catch (RuntimeException e) {
                failed.add(topic);
                log.error("Failed to subscribe shop {} to {}", shopDomain, topic, e);
            }
        }
        return new SubscriptionResult(subscribed, failed);
    }

    private String subscriptionBody(String topic, String address) {
        try {
            return objectMapper.writeValueAsString(
                    Map.of("webhook", Map.of("topic", topic, "address", address, "format", "json")));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize webhook subscription for " + topic, e);
        }
    }
}
