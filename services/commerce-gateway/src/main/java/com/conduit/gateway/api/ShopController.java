package com.conduit.gateway.api;

import com.conduit.client.TenantKey;
import com.conduit.gateway.application.ShopInstallService;
import com.conduit.gateway.application.ShopService;
import com.conduit.gateway.application.WebhookSubscriptionService.SubscriptionResult;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.domain.Identifiers;
import com.conduit.gateway.domain.ShopNotFoundException;
import com.conduit.observability.CorrelationContextHolder;
import jakarta.validation.Valid;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Shop registry of a tenant, the two legs of the OAuth install handshake and re-registration of
 * the shop's webhook subscriptions.
 */
@RestController
@RequestMapping("/api/v1/tenants/{projectId}/{environment}/shops/{shopDomain}")
public class ShopController {

    private final ShopService shopService;
    private final ShopInstallService installService;
    private final ConduitProperties properties;

    public ShopController(ShopService shopService, ShopInstallService installService, ConduitProperties properties) {
        this.shopService = shopService;
        this.installService = installService;
        this.properties = properties;
    }

    @PutMapping
    public ShopStatus install(
            @PathVariable String projectId,
            @PathVariable String environment,
            @PathVariable String shopDomain,
            @Valid @RequestBody ShopInstallRequest request) {
        TenantKey tenantKey = tenantKey(projectId, environment, shopDomain);
        return ShopStatus.of(shopService.install(tenantKey, shopDomain, request.accessToken(), request.scopes()));
    }

    @GetMapping
    public ShopStatus get(
            @PathVariable String projectId, @PathVariable String environment, @PathVariable String shopDomain) {
        TenantKey tenantKey = tenantKey(projectId, environment, shopDomain);
        return shopService.find(tenantKey, shopDomain)
                .map(ShopStatus::of)
                .orElseThrow(() -> new ShopNotFoundException(tenantKey, shopDomain));
    }

    @DeleteMapping
    public ResponseEntity<Void> uninstall(
            @PathVariable String projectId, @PathVariable String environment, @PathVariable String shopDomain) {
        boolean removed = shopService.uninstall(tenantKey(projectId, environment, shopDomain), shopDomain);
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    @GetMapping("/oauth/authorize")
    public Map<String, String> authorize(
            @PathVariable String projectId,
            @PathVariable String environment,
            @PathVariable String shopDomain,
            @RequestParam(defaultValue = "") String scopes,
            @RequestParam String redirectUri) {
        TenantKey tenantKey = tenantKey(projectId, environment, shopDomain);
        ShopInstallService.Authorization authorization =
                installService.authorize(tenantKey, shopDomain, splitScopes(scopes), redirectUri);
        return Map.of("url", authorization.url(), "state", authorization.state());
    }

    @PostMapping("/oauth/token")
    public ShopStatus exchangeToken(
            @PathVariable String projectId,
            @PathVariable String environment,
            @PathVariable String shopDomain,
            @Valid @RequestBody TokenExchangeRequest request) {
        TenantKey tenantKey = tenantKey(projectId, environment, shopDomain);
        return ShopStatus.of(installService.completeInstall(tenantKey, shopDomain, request.code(), request.scopes()));
    }

    @PostMapping("/webhooks")
    public SubscriptionResult resubscribe(
            @PathVariable String projectId, @PathVariable String environment, @PathVariable String shopDomain) {
        return installService.resubscribe(tenantKey(projectId, environment, shopDomain), shopDomain);
    }

    private TenantKey tenantKey(String projectId, String environment, String shopDomain) {
        TenantKey tenantKey = Identifiers.tenantKey(projectId, environment, properties.defaultEnvironment());
        Identifiers.requireShopDomain(shopDomain);
        CorrelationContextHolder.enrich(tenantKey.value(), shopDomain);
        return tenantKey;
    }

    private static List<String> splitScopes(String scopes) {
        return Arrays.stream(scopes.split(","))
                .map(String::trim)
                .filter(scope -> !scope.isEmpty())
                .toList();
    }
}
