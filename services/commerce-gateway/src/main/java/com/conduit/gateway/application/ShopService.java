package com.conduit.gateway.application;

import com.conduit.client.TenantKey;
import com.conduit.gateway.application.port.ShopRepository;
import com.conduit.gateway.domain.Identifiers;
import com.conduit.gateway.domain.ShopNotFoundException;
import com.conduit.gateway.domain.ShopRecord;
import com.conduit.security.CredentialCipher;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/** Registry of shops that installed a tenant's app, holding their encrypted access tokens. */
@Service
public class ShopService {

    private static final Logger log = LoggerFactory.getLogger(ShopService.class);

    private final ShopRepository repository;
    private final CredentialCipher cipher;
    private final Clock clock;

    @Autowired
    public ShopService(ShopRepository repository, CredentialCipher cipher) {
        this(repository, cipher, Clock.systemUTC());
    }

    ShopService(ShopRepository repository, CredentialCipher cipher, Clock clock) {
        this.repository = repository;
        this.cipher = cipher;
        this.clock = clock;
    }

    public ShopRecord install(TenantKey tenantKey, String shopDomain, String accessToken, List<String> scopes) {
        Identifiers.requireShopDomain(shopDomain);
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("accessToken must not be null or blank");
        }
        Instant now = clock.instant();
        Instant installedAt = repository.find(tenantKey, shopDomain).map(ShopRecord::installedAt).orElse(now);
        ShopRecord saved = repository.save(
                new ShopRecord(shopDomain, tenantKey, cipher.encrypt(accessToken), scopes, installedAt, now));
        log.info("Installed shop {} for tenant {}", shopDomain, tenantKey);
        return saved;
    }

    public Optional<ShopRecord> find(TenantKey tenantKey, String shopDomain) {
        return repository.find(tenantKey, shopDomain);
    }

    /**
     * @throws ShopNotFoundException if the shop is not installed for the tenant
     */
    public String accessToken(TenantKey tenantKey, String shopDomain) {
        ShopRecord shop = repository.find(tenantKey, shopDomain)
                .orElseThrow(() -> new ShopNotFoundException(tenantKey, shopDomain));
        return cipher.decrypt(shop.encryptedAccessToken());
    }

    public boolean uninstall(TenantKey tenantKey, String shopDomain) {
        boolean removed = repository.delete(tenantKey, shopDomain);
        if (removed) {
            log.info("Removed shop {} for tenant {}", shopDomain, tenantKey);
        }
        return removed;
    }
}
