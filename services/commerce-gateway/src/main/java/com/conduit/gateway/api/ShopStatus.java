package com.conduit.gateway.api;

import com.conduit.gateway.application.ShopInstallService;
import com.conduit.gateway.domain.ShopRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.List;

/**
 * An installed shop as reported by the admin API, without its token. Webhook topics are only
 * present on the response to a completed OAuth install.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShopStatus(
        String shopDomain,
        String tenantKey,
        List<String> scopes,
        Instant installedAt,
        Instant updatedAt,
        List<String> subscribedTopics,
        List<String> failedTopics) {

    static ShopStatus of(ShopRecord shop) {
        return new ShopStatus(shop.shopDomain(), shop.tenantKey().value(), shop.scopes(),
                shop.installedAt(), shop.updatedAt(), null, null);
    }

    static ShopStatus of(ShopInstallService.Installation installation) {
        ShopRecord shop = installation.shop();
        return new ShopStatus(shop.shopDomain(), shop.tenantKey().value(), shop.scopes(),
                shop.installedAt(), shop.updatedAt(),
                installation.subscriptions().subscribed(), installation.subscriptions().failed());
    }
}
