package com.conduit.gateway.api;

import com.conduit.client.TenantKey;
import com.conduit.gateway.application.TenantCredentialsService;
import com.conduit.gateway.config.ConduitProperties;
import com.conduit.gateway.domain.Identifiers;
import com.conduit.observability.CorrelationContextHolder;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/tenants/{projectId}/{environment}/credentials")
public class TenantCredentialsController {

    private final TenantCredentialsService credentialsService;
    private final ConduitProperties properties;

    public TenantCredentialsController(TenantCredentialsService credentialsService, ConduitProperties properties) {
        this.credentialsService = credentialsService;
        this.properties = properties;
    }

    @PutMapping
    public CredentialsStatus save(
            @PathVariable String projectId,
            @PathVariable String environment,
            @Valid @RequestBody CredentialsRequest request) {
        TenantKey tenantKey = tenantKey(projectId, environment);
        return CredentialsStatus.of(credentialsService.save(tenantKey, request.toCredentials()));
    }

    @GetMapping
    public CredentialsStatus status(@PathVariable String projectId, @PathVariable String environment) {
        TenantKey tenantKey = tenantKey(projectId, environment);
        return credentialsService.find(tenantKey)
                .map(CredentialsStatus::of)
                .orElseGet(() -> CredentialsStatus.notConfigured(tenantKey.value()));
    }

    @DeleteMapping
    public ResponseEntity<Void> delete(@PathVariable String projectId, @PathVariable String environment) {
        boolean removed = credentialsService.delete(tenantKey(projectId, environment));
        return removed ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
    }

    private TenantKey tenantKey(String projectId, String environment) {
        TenantKey tenantKey = Identifiers.tenantKey(projectId, environment, properties.defaultEnvironment());
        CorrelationContextHolder.enrich(tenantKey.value(), null);
        return tenantKey;
    }
}
