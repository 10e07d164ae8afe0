package com.conduit.gateway.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.conduit.client.CancellationToken;
import com.conduit.client.CommerceApi;
import com.conduit.client.OperationCancelledException;
import com.conduit.client.TenantClientPool;
import com.conduit.client.TenantCredentials;
import com.conduit.client.TenantKey;
import com.conduit.client.UpstreamRequest;
import com.conduit.client.UpstreamResponse;
import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.client.ratelimit.RateLimiterConfig;
import com.conduit.client.retry.RetryExecutor;
import com.conduit.client.retry.RetryPolicy;
import com.conduit.gateway.application.WebhookSubscriptionService.SubscriptionResult;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.infrastructure.persistence.InMemoryTenantCredentialsRepository;
import com.conduit.observability.MetricFactory;
import com.conduit.security.AesGcmCredentialCipher;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("WebhookSubscriptionService")
class WebhookSubscriptionServiceTest {

    private static final String KEY = "test-encryption-key-0123456789ab";
    private static final TenantKey TENANT = TenantKey.of("proj", "staging");
    private static final String SHOP = "acme.myshopify.com";
    private static final String CALLBACK_BASE = "https://gateway.example.com/webhooks";

    private final CommerceApi api = mock(CommerceApi.class);
    private final ObjectMapper objectMapper = new ObjectMapper();
    private TenantClientResolver resolver;

    @BeforeEach
    void setUp() {
        MetricFactory metrics = MetricFactory.inMemory("test");
        AesGcmCredentialCipher cipher = AesGcmCredentialCipher.fromString(KEY);
        RetryPolicy retryPolicy =
                new RetryPolicy(1, Duration.ofMillis(1), Duration.ofMillis(5), 2.0, RetryPolicy.DEFAULT_RETRYABLE_STATUSES);
        TenantClientPool pool = new TenantClientPool(credentials -> api,
                new RateLimiter(RateLimiterConfig.defaults(), metrics), new RetryExecutor(metrics), retryPolicy, metrics);
        var credentialsService = new TenantCredentialsService(new InMemoryTenantCredentialsRepository(), cipher, pool);
        credentialsService.save(TENANT, TenantCredentials.of("key", "secret"));
        resolver = new TenantClientResolver(credentialsService, pool);
    }

    private WebhookSubscriptionService service(String callbackBase, List<String> topics) {
        ConduitProperties properties = new ConduitProperties("test", null, KEY, null, null, null, null,
                new ConduitProperties.Webhooks(callbackBase, topics));
        return new WebhookSubscriptionService(resolver, properties, objectMapper);
    }

    @Test
    @DisplayName("creates one subscription per default topic pointing at the tenant's webhook endpoint")
    void subscribesDefaultTopics() throws Exception {
        when(api.send(any())).thenReturn(UpstreamResponse.of(201, "{\"webhook\":{\"id\":1}}"));

        SubscriptionResult result =
                service(CALLBACK_BASE, null).subscribe(TENANT, SHOP, "shpat_token", CancellationToken.none());

        assertThat(result.subscribed()).containsExactlyElementsOf(ConduitProperties.Webhooks.DEFAULT_SUBSCRIPTION_TOPICS);
        assertThat(result.failed()).isEmpty();

        ArgumentCaptor<UpstreamRequest> sent = ArgumentCaptor.forClass(UpstreamRequest.class);
        verify(api, times(5)).send(sent.capture());
        UpstreamRequest first = sent.getAllValues().get(0);
        assertThat(first.method()).isEqualTo("POST");
        assertThat(first.path()).isEqualTo("webhooks.json");
        assertThat(first.shopDomain()).isEqualTo(SHOP);
        assertThat(first.accessToken()).isEqualTo("shpat_token");

        JsonNode webhook = objectMapper.readTree(first.body()).get("webhook");
        assertThat(webhook.get("topic").asText()).isEqualTo("orders/create");
        assertThat(webhook.get("address").asText()).isEqualTo(CALLBACK_BASE + "/proj/staging");
        assertThat(webhook.get("format").asText()).isEqualTo("json");
    }

    @Test
    @DisplayName("an existing subscription counts as subscribed and a rejected topic does not stop the rest")
    void partialFailure() {
        when(api.send(any())).thenReturn(
                UpstreamResponse.of(422, "{\"errors\":{\"address\":[\"for this topic has already been taken\"]}}"),
                UpstreamResponse.of(403, "{\"errors\":\"missing scope\"}"),
                UpstreamResponse.of(201, "{}"));

        SubscriptionResult result = service(CALLBACK_BASE, List.of("orders/create", "customers/create", "app/uninstalled"))
                .subscribe(TENANT, SHOP, "shpat_token", CancellationToken.none());

        assertThat(result.subscribed()).containsExactly("orders/create", "app/uninstalled");
        assertThat(result.failed()).containsExactly("customers/create");
    }

    @Test
    @DisplayName("an upstream error on one topic is reported and the next topic is still attempted")
    void upstreamErrorIsolated() {
        when(api.send(any()))
                .thenThrow(new IllegalStateException("unexpected response"))
                .thenReturn(UpstreamResponse.of(201, "{}"));

        SubscriptionResult result = service(CALLBACK_BASE, List.of("products/create", "products/update"))
                .subscribe(TENANT, SHOP, "shpat_token", CancellationToken.none());

        assertThat(result.failed()).containsExactly("products/create");
        assertThat(result.subscribed()).containsExactly("products/update");
    }

    @Test
    @DisplayName("cancellation aborts the whole subscription run")
    void cancellationPropagates() {
        CancellationToken cancellation = CancellationToken.create();
        cancellation.cancel();

        assertThatThrownBy(() -> service(CALLBACK_BASE, null).subscribe(TENANT, SHOP, "shpat_token", cancellation))
                .isInstanceOf(OperationCancelledException.class);
        verify(api, never()).send(any());
    }

    @Test
    @DisplayName("without a callback URL nothing is subscribed")
    void skippedWithoutCallback() {
        SubscriptionResult result = service(null, null).subscribe(TENANT, SHOP, "shpat_token", CancellationToken.none());

        assertThat(result.subscribed()).isEmpty();
        assertThat(result.failed()).isEmpty();
        verify(api, never()).send(any());
    }
}
