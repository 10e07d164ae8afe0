package com.conduit.gateway.infrastructure.persistence;

import com.conduit.client.TenantKey;
import com.conduit.gateway.application.port.ShopRepository;
import com.conduit.gateway.domain.ShopRecord;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

/** Process-local shop store keyed by tenant and shop domain. */
@Repository
public class InMemoryShopRepository implements ShopRepository {

    private record Key(TenantKey tenantKey, String shopDomain) {}

    private final ConcurrentMap<Key, ShopRecord> store = new ConcurrentHashMap<>();

    @Override
    public ShopRecord save(ShopRecord shop) {
        store.put(new Key(shop.tenantKey(), shop.shopDomain()), shop);
        return shop;
    }

    @Override
    public Optional<ShopRecord> find(TenantKey tenantKey, String shopDomain) {
        return Optional.ofNullable(store.get(new Key(tenantKey, shopDomain)));
    }

    @Override
    public boolean delete(TenantKey tenantKey, String shopDomain) {
        return store.remove(new Key(tenantKey, shopDomain)) != null;
    }
}
