package com.conduit.gateway.infrastructure.persistence;

import com.conduit.client.TenantKey;
import com.conduit.gateway.application.port.TenantCredentialsRepository;
import com.conduit.gateway.domain.StoredCredentials;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.springframework.stereotype.Repository;

/** Process-local credentials store; contents are lost on restart. */
@Repository
public class InMemoryTenantCredentialsRepository implements TenantCredentialsRepository {

    private final ConcurrentMap<TenantKey, StoredCredentials> store = new ConcurrentHashMap<>();

    @Override
    public StoredCredentials save(StoredCredentials credentials) {
        store.put(credentials.tenantKey(), credentials);
        return credentials;
    }

    @Override
    public Optional<StoredCredentials> find(TenantKey tenantKey) {
        return Optional.ofNullable(store.get(tenantKey));
    }

    @Override
    public boolean delete(TenantKey tenantKey) {
        return store.remove(tenantKey) != null;
    }
}
