package com.conduit.gateway.application;

import com.conduit.client.CancellationToken;
import com.conduit.client.TenantKey;
import com.conduit.gateway.application.WebhookSubscriptionService.SubscriptionResult;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.domain.Identifiers;
import com.conduit.gateway.domain.ShopRecord;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import org.springframework.stereotype.Service;

/**
 * OAuth install handshake: builds the authorization URL a merchant is sent to and exchanges the
 * returned code for an access token, which is then stored in the shop registry. A completed
 * install subscribes the shop to the configured webhook topics.
 */
@Service
public class ShopInstallService {

    /**
     * @param url authorization URL on the shop
     * @param state opaque value the caller must check on the redirect
     */
    public record Authorization(String url, String state) {}

    /**
     * @param shop the stored shop
     * @param subscriptions webhook topics registered on the shop
     */
    public record Installation(ShopRecord shop, SubscriptionResult subscriptions) {}

    private final TenantClientResolver clientResolver;
    private final ShopService shopService;
    private final WebhookSubscriptionService subscriptionService;
    private final Duration requestDeadline;

    public ShopInstallService(
            TenantClientResolver clientResolver,
            ShopService shopService,
            WebhookSubscriptionService subscriptionService,
            ConduitProperties properties) {
        this.clientResolver = clientResolver;
        this.shopService = shopService;
        this.subscriptionService = subscriptionService;
        this.requestDeadline = properties.upstream().requestDeadline();
    }

    public Authorization authorize(TenantKey tenantKey, String shopDomain, List<String> scopes, String redirectUri) {
        Identifiers.requireShopDomain(shopDomain);
        if (redirectUri == null || redirectUri.isBlank()) {
            throw new IllegalArgumentException("redirectUri must not be null or blank");
        }
        String state = UUID.randomUUID().toString();
        String url = clientResolver.clientFor(tenantKey).authorizationUrl(shopDomain, scopes, redirectUri, state);
        return new Authorization(url, state);
    }

    public Installation completeInstall(TenantKey tenantKey, String shopDomain, String code, List<String> scopes) {
        Identifiers.requireShopDomain(shopDomain);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code must not be null or blank");
        }
        CancellationToken deadline = CancellationToken.withTimeout(requestDeadline);
        String accessToken = clientResolver.clientFor(tenantKey).exchangeToken(shopDomain, code, deadline);
        ShopRecord shop = shopService.install(tenantKey, shopDomain, accessToken, scopes);
        return new Installation(shop, subscriptionService.subscribe(tenantKey, shopDomain, accessToken, deadline));
    }

    /**
     * Registers the configured webhook topics again for an installed shop.
     *
     * @throws com.conduit.gateway.domain.ShopNotFoundException if the shop is not installed
     */
    public SubscriptionResult resubscribe(TenantKey tenantKey, String shopDomain) {
        String accessToken = shopService.accessToken(tenantKey, shopDomain);
        return subscriptionService.subscribe(
                tenantKey, shopDomain, accessToken, CancellationToken.withTimeout(requestDeadline));
    }
}
