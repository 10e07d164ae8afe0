package com.conduit.observability;

/**
 * Immutable correlation context that travels with one inbound request or webhook delivery.
 * <p>
 * The gateway establishes a {@code CorrelationContext} at the HTTP edge and enriches it once the
 * tenant and the upstream shop are known. The values are mirrored into SLF4J MDC by
 * {@link CorrelationContextHolder} so that every log line of a tenant's traffic can be grouped.
 *
 * @param correlationId unique ID for the request flow (propagated via {@code X-Correlation-ID})
 * @param tenantKey     tenant key ({@code projectId-environment}), nullable until resolved
 * @param shopDomain    upstream account the request targets, nullable until resolved
 * @param requestId     unique ID for this specific request (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantKey,
        String shopDomain,
        String requestId
) {

    /** MDC key for correlation ID. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for tenant key. */
    public static final String MDC_TENANT_KEY = "tenantKey";

    /** MDC key for shop domain. */
    public static final String MDC_SHOP_DOMAIN = "shopDomain";

    /** MDC key for request ID. */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * Rejects a missing correlation ID.
     */
    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context carrying only a correlation ID.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null);
    }

    /**
     * Returns a copy of this context scoped to the given tenant and shop.
     *
     * @param tenantKey  tenant key value
     * @param shopDomain upstream shop domain (nullable)
     */
    public CorrelationContext withTenant(String tenantKey, String shopDomain) {
        return new CorrelationContext(correlationId, tenantKey, shopDomain, requestId);
    }
}
