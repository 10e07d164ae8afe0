package com.conduit.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Thread-local holder for {@link CorrelationContext} with SLF4J MDC bridge.
 * <p>
 * When a correlation context is set, the MDC keys (correlationId, tenantKey, shopDomain,
 * requestId) are populated so that every log statement on this thread includes them. When
 * cleared, all MDC keys are removed.
 * <p>
 * Work handed to another thread (for example a client construction waited on by several
 * request threads) does not inherit the context; use
 * {@link #runWithContext(CorrelationContext, Runnable)} for explicit handoff.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the correlation context for the current thread and populates SLF4J MDC.
     *
     * @param context the correlation context to set (must not be null)
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /**
     * Returns the current thread's correlation context, if set.
     */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Scopes the current context to a tenant and shop. Starts a fresh context with a generated
     * correlation ID when none is set.
     *
     * @param tenantKey  tenant key value
     * @param shopDomain upstream shop domain (nullable)
     */
    public static void enrich(String tenantKey, String shopDomain) {
        CorrelationContext current = CONTEXT.get();
        if (current == null) {
            current = CorrelationContext.of(UUID.randomUUID().toString());
        }
        set(current.withTenant(tenantKey, shopDomain));
    }

    /**
     * Clears the correlation context and removes all MDC keys for the current thread.
     */
    public static void clear() {
        CONTEXT.remove();
        clearMdc();
    }

    /**
     * Executes a {@link Runnable} with the given correlation context set, then restores
     * the previous context (or clears if there was none).
     *
     * @param context  the correlation context for the duration of the runnable
     * @param runnable the work to execute
     */
    public static void runWithContext(CorrelationContext context, Runnable runnable) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            runnable.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    private static void populateMdc(CorrelationContext ctx) {
        setMdc(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        setMdc(CorrelationContext.MDC_TENANT_KEY, ctx.tenantKey());
        setMdc(CorrelationContext.MDC_SHOP_DOMAIN, ctx.shopDomain());
        setMdc(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
    }

    private static void setMdc(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }

    private static void clearMdc() {
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_KEY);
        MDC.remove(CorrelationContext.MDC_SHOP_DOMAIN);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
    }
}
