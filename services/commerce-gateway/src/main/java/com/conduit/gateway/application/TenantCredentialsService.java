package com.conduit.gateway.application;

import com.conduit.client.TenantClientPool;
import com.conduit.client.TenantCredentials;
import com.conduit.client.TenantKey;
import com.conduit.gateway.application.port.TenantCredentialsRepository;
import com.conduit.gateway.domain.StoredCredentials;
import com.conduit.gateway.domain.TenantNotConfiguredException;
import com.conduit.security.CredentialCipher;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Administration of tenant credentials.
 *
 * <p>Secrets are encrypted before they reach the repository and decrypted only when a client or
 * the signature verifier needs them. Saving or deleting credentials invalidates the tenant's
 * pooled client so the next call is built from the stored values.
 */
@Service
public class TenantCredentialsService {

    private static final Logger log = LoggerFactory.getLogger(TenantCredentialsService.class);

    private final TenantCredentialsRepository repository;
    private final CredentialCipher cipher;
    private final TenantClientPool clientPool;
    private final Clock clock;

    @Autowired
    public TenantCredentialsService(
            TenantCredentialsRepository repository, CredentialCipher cipher, TenantClientPool clientPool) {
        this(repository, cipher, clientPool, Clock.systemUTC());
    }

    TenantCredentialsService(
            TenantCredentialsRepository repository,
            CredentialCipher cipher,
            TenantClientPool clientPool,
            Clock clock) {
        this.repository = repository;
        this.cipher = cipher;
        this.clientPool = clientPool;
        this.clock = clock;
    }

    /** Stores (or replaces) the tenant's credentials and drops its cached client. */
    public StoredCredentials save(TenantKey tenantKey, TenantCredentials credentials) {
        Instant now = clock.instant();
        Instant createdAt = repository.find(tenantKey).map(StoredCredentials::createdAt).orElse(now);
        String webhookSecret =
                credentials.webhookSecret() == null ? null : cipher.encrypt(credentials.webhookSecret());
        StoredCredentials stored = repository.save(new StoredCredentials(
                tenantKey,
                credentials.apiKey(),
                cipher.encrypt(credentials.apiSecret()),
                webhookSecret,
                createdAt,
                now));
        clientPool.invalidateClient(tenantKey);
        log.info("Stored credentials for tenant {}", tenantKey);
        return stored;
    }

    /**
     * Decrypted credentials of a tenant.
     *
     * @throws TenantNotConfiguredException if none are stored
     */
    public TenantCredentials resolve(TenantKey tenantKey) {
        StoredCredentials stored = repository.find(tenantKey)
                .orElseThrow(() -> new TenantNotConfiguredException(tenantKey));
        String webhookSecret = stored.hasWebhookSecret() ? cipher.decrypt(stored.encryptedWebhookSecret()) : null;
        return new TenantCredentials(stored.apiKey(), cipher.decrypt(stored.encryptedApiSecret()), webhookSecret);
    }

    /** Stored record without decrypting anything. */
    public Optional<StoredCredentials> find(TenantKey tenantKey) {
        return repository.find(tenantKey);
    }

    public boolean delete(TenantKey tenantKey) {
        boolean removed = repository.delete(tenantKey);
        clientPool.invalidateClient(tenantKey);
        if (removed) {
            log.info("Deleted credentials for tenant {}", tenantKey);
        }
        return removed;
    }
}
