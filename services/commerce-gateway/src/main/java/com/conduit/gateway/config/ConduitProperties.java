package com.conduit.gateway.config;

import com.conduit.client.ratelimit.RateLimiterConfig;
import com.conduit.client.TenantKey;
import com.conduit.client.retry.RetryPolicy;
import com.conduit.webhook.WebhookTopic;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the gateway, bound from the {@code conduit.*} prefix.
 *
 * <p>Optional fields are defaulted in the compact constructors, which run before Bean
 * Validation. The encryption key is the only setting without a default.
 *
 * <pre>
 * conduit:
 *   service-name: commerce-gateway
 *   encryption-key: ${CONDUIT_ENCRYPTION_KEY}
 *   rate-limit:
 *     max-requests: 35
 *     window: 1m
 *   webhooks:
 *     callback-base-url: https://gateway.example.com/webhooks
 * </pre>
 *
 * @param serviceName service name used as the metrics tag
 * @param environment deployment environment
 * @param encryptionKey 32-byte key for secrets at rest
 * @param defaultEnvironment tenant environment used when a request omits it
 * @param upstream upstream API settings
 * @param rateLimit per-shop rate limiting
 * @param retry upstream retry policy
 * @param webhooks webhook subscriptions created on install
 */
@ConfigurationProperties(prefix = "conduit")
@Validated
public record ConduitProperties(
        @NotBlank String serviceName,
        String environment,
        @NotBlank String encryptionKey,
        String defaultEnvironment,
        @Valid Upstream upstream,
        @Valid RateLimit rateLimit,
        @Valid Retry retry,
        @Valid Webhooks webhooks) {

    public ConduitProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (defaultEnvironment == null || defaultEnvironment.isBlank()) {
            defaultEnvironment = "master";
        }
        if (upstream == null) {
            upstream = new Upstream(null, null, null, null);
        }
        if (rateLimit == null) {
            rateLimit = new RateLimit(null, null, null, null);
        }
        if (retry == null) {
            retry = new Retry(null, null, null, null, null);
        }
        if (webhooks == null) {
            webhooks = new Webhooks(null, null);
        }
    }

    /**
     * @param apiVersion admin API version in request paths
     * @param connectTimeout TCP connect timeout
     * @param readTimeout socket read timeout
     * @param requestDeadline overall budget for one proxied call including waits and retries
     */
    public record Upstream(
            String apiVersion, Duration connectTimeout, Duration readTimeout, Duration requestDeadline) {

        public Upstream {
            if (apiVersion == null || apiVersion.isBlank()) {
                apiVersion = "2024-01";
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(30);
            }
            if (requestDeadline == null) {
                requestDeadline = Duration.ofSeconds(60);
            }
        }
    }

    public record RateLimit(Integer maxRequests, Duration window, Duration minWait, Duration maxWait) {

        public RateLimit {
            if (maxRequests == null) {
                maxRequests = RateLimiterConfig.DEFAULT_MAX_REQUESTS;
            }
            if (window == null) {
                window = RateLimiterConfig.DEFAULT_WINDOW;
            }
            if (minWait == null) {
                minWait = RateLimiterConfig.DEFAULT_MIN_WAIT;
            }
            if (maxWait == null) {
                maxWait = RateLimiterConfig.DEFAULT_MAX_WAIT;
            }
        }

        public RateLimiterConfig toConfig() {
            return new RateLimiterConfig(maxRequests, window, minWait, maxWait);
        }
    }

    public record Retry(
            Integer maxRetries,
            Duration initialDelay,
            Duration maxDelay,
            Double backoffFactor,
            Set<Integer> retryableStatuses) {

        public Retry {
            RetryPolicy defaults = RetryPolicy.defaults();
            if (maxRetries == null) {
                maxRetries = defaults.maxRetries();
            }
            if (initialDelay == null) {
                initialDelay = defaults.initialDelay();
            }
            if (maxDelay == null) {
                maxDelay = defaults.maxDelay();
            }
            if (backoffFactor == null) {
                backoffFactor = defaults.backoffFactor();
            }
            if (retryableStatuses == null || retryableStatuses.isEmpty()) {
                retryableStatuses = defaults.retryableStatuses();
            }
        }

        public RetryPolicy toPolicy() {
            return new RetryPolicy(maxRetries, initialDelay, maxDelay, backoffFactor, retryableStatuses);
        }
    }

    /**
     * @param callbackBaseUrl public base of the webhook endpoint; subscriptions are skipped when unset
     * @param subscriptionTopics topics every newly installed shop is subscribed to
     */
    public record Webhooks(String callbackBaseUrl, List<String> subscriptionTopics) {

        public static final List<String> DEFAULT_SUBSCRIPTION_TOPICS = List.of(
                WebhookTopic.ORDERS_CREATE.value(),
                WebhookTopic.ORDERS_UPDATED.value(),
                WebhookTopic.PRODUCTS_CREATE.value(),
                WebhookTopic.PRODUCTS_UPDATE.value(),
                WebhookTopic.APP_UNINSTALLED.value());

        public Webhooks {
            if (callbackBaseUrl != null) {
                callbackBaseUrl = callbackBaseUrl.strip();
                while (callbackBaseUrl.endsWith("/")) {
                    callbackBaseUrl = callbackBaseUrl.substring(0, callbackBaseUrl.length() - 1);
                }
                if (callbackBaseUrl.isEmpty()) {
                    callbackBaseUrl = null;
                }
            }
            if (subscriptionTopics == null || subscriptionTopics.isEmpty()) {
                subscriptionTopics = DEFAULT_SUBSCRIPTION_TOPICS;
            }
            for (String topic : subscriptionTopics) {
                if (!WebhookTopic.isKnown(topic)) {
                    throw new IllegalArgumentException("Unknown webhook subscription topic: " + topic);
                }
            }
            subscriptionTopics = List.copyOf(subscriptionTopics);
        }

        public boolean subscriptionsEnabled() {
            return callbackBaseUrl != null;
        }

        /** Address the provider delivers a tenant's webhooks to. */
        public String callbackUrl(TenantKey tenantKey) {
            if (callbackBaseUrl == null) {
                throw new IllegalStateException("conduit.webhooks.callback-base-url is not configured");
            }
            return callbackBaseUrl + "/" + tenantKey.projectId() + "/" + tenantKey.environment();
        }
    }
}
