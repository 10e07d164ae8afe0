package com.conduit.gateway.application.port;

import com.conduit.client.TenantKey;
import com.conduit.gateway.domain.StoredCredentials;
import java.util.Optional;

/** Persistence of tenant credentials. Secrets arrive already encrypted. */
public interface TenantCredentialsRepository {

    StoredCredentials save(StoredCredentials credentials);

    Optional<StoredCredentials> find(TenantKey tenantKey);

    /** @return whether anything was removed */
    boolean delete(TenantKey tenantKey);
}
