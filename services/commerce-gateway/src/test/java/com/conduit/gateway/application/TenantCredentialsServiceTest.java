package com.conduit.gateway.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.conduit.client.CommerceApi;
import com.conduit.client.CommerceApiFactory;
import com.conduit.client.TenantClient;
import com.conduit.client.TenantClientPool;
import com.conduit.client.TenantCredentials;
import com.conduit.client.TenantKey;
import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.client.ratelimit.RateLimiterConfig;
import com.conduit.client.retry.RetryExecutor;
import com.conduit.client.retry.RetryPolicy;
import com.conduit.gateway.domain.StoredCredentials;
import com.conduit.gateway.domain.TenantNotConfiguredException;
import com.conduit.gateway.infrastructure.persistence.InMemoryTenantCredentialsRepository;
import com.conduit.observability.MetricFactory;
import com.conduit.security.AesGcmCredentialCipher;
import java.time.Clock;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("TenantCredentialsService")
class TenantCredentialsServiceTest {

    private static final TenantKey TENANT = TenantKey.of("proj", "master");
    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final InMemoryTenantCredentialsRepository repository = new InMemoryTenantCredentialsRepository();
    private final AesGcmCredentialCipher cipher = AesGcmCredentialCipher.fromString("test-encryption-key-0123456789ab");
    private TenantClientPool pool;
    private TenantCredentialsService service;

    @BeforeEach
    void setUp() {
        MetricFactory metrics = MetricFactory.inMemory("test");
        CommerceApiFactory factory = mock(CommerceApiFactory.class);
        when(factory.create(any())).thenAnswer(invocation -> mock(CommerceApi.class));
        pool = new TenantClientPool(factory, new RateLimiter(RateLimiterConfig.defaults(), metrics),
                new RetryExecutor(metrics), RetryPolicy.defaults(), metrics);
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(T0, T0.plusSeconds(60));
        service = new TenantCredentialsService(repository, cipher, pool, clock);
    }

    @Nested
    @DisplayName("save")
    class Save {

        @Test
        @DisplayName("stores secrets encrypted")
        void encryptsSecrets() {
            StoredCredentials stored = service.save(TENANT, new TenantCredentials("key", "secret", "hook"));

            assertThat(stored.encryptedApiSecret()).isNotEqualTo("secret");
            assertThat(cipher.decrypt(stored.encryptedApiSecret())).isEqualTo("secret");
            assertThat(cipher.decrypt(stored.encryptedWebhookSecret())).isEqualTo("hook");
            assertThat(stored.apiKey()).isEqualTo("key");
        }

        @Test
        @DisplayName("keeps the creation time across updates")
        void keepsCreatedAt() {
            service.save(TENANT, TenantCredentials.of("key", "secret"));

            StoredCredentials updated = service.save(TENANT, TenantCredentials.of("key", "rotated"));

            assertThat(updated.createdAt()).isEqualTo(T0);
            assertThat(updated.updatedAt()).isEqualTo(T0.plusSeconds(60));
        }

        @Test
        @DisplayName("invalidates the cached client so rotated credentials take effect")
        void invalidatesClient() {
            service.save(TENANT, TenantCredentials.of("key", "secret"));
            TenantClient before = pool.getClient(TENANT, service.resolve(TENANT));

            service.save(TENANT, TenantCredentials.of("key", "rotated"));

            assertThat(pool.isCached(TENANT)).isFalse();
            TenantClient after = pool.getClient(TENANT, service.resolve(TENANT));
            assertThat(after).isNotSameAs(before);
            assertThat(after.credentials().apiSecret()).isEqualTo("rotated");
        }
    }

    @Nested
    @DisplayName("resolve")
    class Resolve {

        @Test
        @DisplayName("decrypts stored credentials")
        void decrypts() {
            service.save(TENANT, new TenantCredentials("key", "secret", "hook"));

            TenantCredentials resolved = service.resolve(TENANT);

            assertThat(resolved.apiSecret()).isEqualTo("secret");
            assertThat(resolved.webhookSigningSecret()).isEqualTo("hook");
        }

        @Test
        @DisplayName("falls back to the api secret for webhooks when no dedicated secret is set")
        void webhookSecretFallback() {
            service.save(TENANT, TenantCredentials.of("key", "secret"));

            assertThat(service.resolve(TENANT).webhookSigningSecret()).isEqualTo("secret");
        }

        @Test
        @DisplayName("throws for an unknown tenant")
        void unknownTenant() {
            assertThatThrownBy(() -> service.resolve(TENANT))
                    .isInstanceOf(TenantNotConfiguredException.class)
                    .hasMessageContaining("proj-master");
        }
    }

    @Test
    @DisplayName("delete removes the credentials and the cached client")
    void deleteInvalidates() {
        service.save(TENANT, TenantCredentials.of("key", "secret"));
        pool.getClient(TENANT, service.resolve(TENANT));

        assertThat(service.delete(TENANT)).isTrue();
        assertThat(pool.isCached(TENANT)).isFalse();
        assertThat(service.find(TENANT)).isEmpty();
        assertThat(service.delete(TENANT)).isFalse();
    }
}
