package com.conduit.gateway.config;

import com.conduit.client.CommerceApiFactory;
import com.conduit.client.TenantClientPool;
import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.client.retry.RetryExecutor;
import com.conduit.client.retry.RetryPolicy;
import com.conduit.gateway.infrastructure.upstream.RestCommerceApiFactory;
import com.conduit.observability.MetricFactory;
import com.conduit.security.AesGcmCredentialCipher;
import com.conduit.security.CredentialCipher;
import com.conduit.security.WebhookSignatureVerifier;
import com.conduit.webhook.WebhookDispatcher;
import com.conduit.webhook.WebhookHandler;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

/**
 * Wires the framework-free libraries into the application context. One rate limiter and one
 * client pool serve every tenant.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ConduitProperties properties) {
        return new MetricFactory(registry, properties.serviceName());
    }

    @Bean
    public CredentialCipher credentialCipher(ConduitProperties properties) {
        return AesGcmCredentialCipher.fromString(properties.encryptionKey());
    }

    @Bean
    public WebhookSignatureVerifier webhookSignatureVerifier() {
        return new WebhookSignatureVerifier();
    }

    @Bean
    public RateLimiter rateLimiter(ConduitProperties properties, MetricFactory metrics) {
        return new RateLimiter(properties.rateLimit().toConfig(), metrics);
    }

    @Bean
    public RetryPolicy retryPolicy(ConduitProperties properties) {
        return properties.retry().toPolicy();
    }

    @Bean
    public RetryExecutor retryExecutor(MetricFactory metrics) {
        return new RetryExecutor(metrics);
    }

    @Bean
    public RestTemplate upstreamRestTemplate(RestTemplateBuilder builder, ConduitProperties properties) {
        return builder
                .setConnectTimeout(properties.upstream().connectTimeout())
                .setReadTimeout(properties.upstream().readTimeout())
                .build();
    }

    @Bean
    public CommerceApiFactory commerceApiFactory(RestTemplate upstreamRestTemplate, ConduitProperties properties) {
        return new RestCommerceApiFactory(upstreamRestTemplate, properties.upstream().apiVersion());
    }

    @Bean
    public TenantClientPool tenantClientPool(
            CommerceApiFactory apiFactory,
            RateLimiter rateLimiter,
            RetryExecutor retryExecutor,
            RetryPolicy retryPolicy,
            MetricFactory metrics) {
        return new TenantClientPool(apiFactory, rateLimiter, retryExecutor, retryPolicy, metrics);
    }

    @Bean
    public WebhookDispatcher webhookDispatcher(MetricFactory metrics, List<WebhookHandler> handlers) {
        WebhookDispatcher dispatcher = new WebhookDispatcher(metrics);
        handlers.forEach(dispatcher::registerHandler);
        log.info("Registered {} webhook handler(s)", dispatcher.handlerCount());
        return dispatcher;
    }
}
