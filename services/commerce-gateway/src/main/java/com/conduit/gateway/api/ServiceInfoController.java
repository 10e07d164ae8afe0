package com.conduit.gateway.api;

import com.conduit.client.TenantClientPool;
import com.conduit.client.ratelimit.RateLimiter;
import com.conduit.gateway.config.ConduitProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime view of the gateway. Actuator's {@code /actuator/info} covers build
 * metadata; this adds the upstream settings and pool sizes.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final ConduitProperties properties;
    private final TenantClientPool clientPool;
    private final RateLimiter rateLimiter;

    public ServiceInfoController(ConduitProperties properties, TenantClientPool clientPool, RateLimiter rateLimiter) {
        this.properties = properties;
        this.clientPool = clientPool;
        this.rateLimiter = rateLimiter;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.serviceName(),
                "environment", properties.environment(),
                "apiVersion", properties.upstream().apiVersion(),
                "cachedClients", clientPool.size(),
                "rateLimitBuckets", rateLimiter.bucketCount(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
