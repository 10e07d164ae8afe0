package com.conduit.gateway.application.port;

import com.conduit.client.TenantKey;
import com.conduit.gateway.domain.ShopRecord;
import java.util.Optional;

/** Persistence of installed shops and their encrypted access tokens. */
public interface ShopRepository {

    ShopRecord save(ShopRecord shop);

    Optional<ShopRecord> find(TenantKey tenantKey, String shopDomain);

    /** @return whether anything was removed */
    boolean delete(TenantKey tenantKey, String shopDomain);
}
