package com.conduit.gateway.infrastructure.persistence;

import static org.assertj.core.api.Assertions.assertThat;

import com.conduit.client.TenantKey;
import com.conduit.gateway.domain.ShopRecord;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryShopRepository")
class InMemoryShopRepositoryTest {

    private static final String SHOP = "acme.myshopify.com";

    private final InMemoryShopRepository repository = new InMemoryShopRepository();

    private static ShopRecord shop(TenantKey tenantKey) {
        Instant now = Instant.now();
        return new ShopRecord(SHOP, tenantKey, "ciphertext", List.of("read_orders"), now, now);
    }

    @Test
    @DisplayName("keeps one record per tenant for the same shop")
    void separatesTenants() {
        TenantKey a = TenantKey.of("a", "master");
        TenantKey b = TenantKey.of("b", "master");
        repository.save(shop(a));
        repository.save(shop(b));

        assertThat(repository.find(a, SHOP)).isPresent();
        assertThat(repository.delete(a, SHOP)).isTrue();
        assertThat(repository.find(a, SHOP)).isEmpty();
        assertThat(repository.find(b, SHOP)).isPresent();
    }

    @Test
    @DisplayName("keys whose string forms coincide stay separate")
    void separatesTenantsWithCollidingValues() {
        TenantKey owner = TenantKey.of("acme-prod", "main");
        TenantKey other = TenantKey.of("acme", "prod-main");
        repository.save(shop(owner));

        assertThat(other.value()).isEqualTo(owner.value());
        assertThat(repository.find(other, SHOP)).isEmpty();
        assertThat(repository.delete(other, SHOP)).isFalse();
        assertThat(repository.find(owner, SHOP)).isPresent();
    }

    @Test
    @DisplayName("delete reports whether anything was removed")
    void deleteReportsRemoval() {
        assertThat(repository.delete(TenantKey.of("a", "master"), SHOP)).isFalse();
    }
}
