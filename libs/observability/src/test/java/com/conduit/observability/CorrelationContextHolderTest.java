package com.conduit.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link CorrelationContextHolder}: ThreadLocal storage, MDC bridge, tenant
 * enrichment and scoped execution.
 */
@DisplayName("CorrelationContextHolder")
class CorrelationContextHolderTest {

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Nested
    @DisplayName("set/get/clear lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("should return empty when no context is set")
        void shouldReturnEmptyWhenNoContext() {
            assertThat(CorrelationContextHolder.get()).isEmpty();
        }

        @Test
        @DisplayName("should store and retrieve context")
        void shouldStoreAndRetrieveContext() {
            var ctx = new CorrelationContext("corr-1", "proj-1-master", "acme.myshopify.com", "req-1");
            CorrelationContextHolder.set(ctx);

            assertThat(CorrelationContextHolder.get()).isPresent().contains(ctx);
        }

        @Test
        @DisplayName("should reject null context")
        void shouldRejectNullContext() {
            assertThatThrownBy(() -> CorrelationContextHolder.set(null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("context");
        }

        @Test
        @DisplayName("should reject blank correlation id")
        void shouldRejectBlankCorrelationId() {
            assertThatThrownBy(() -> CorrelationContext.of(" "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("correlationId");
        }
    }

    @Nested
    @DisplayName("MDC bridge")
    class MdcBridge {

        @Test
        @DisplayName("should populate MDC keys when context is set")
        void shouldPopulateMdcOnSet() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "proj-1-master", "acme.myshopify.com", "req-1"));

            assertThat(MDC.get("correlationId")).isEqualTo("corr-1");
            assertThat(MDC.get("tenantKey")).isEqualTo("proj-1-master");
            assertThat(MDC.get("shopDomain")).isEqualTo("acme.myshopify.com");
            assertThat(MDC.get("requestId")).isEqualTo("req-1");
        }

        @Test
        @DisplayName("should clear MDC keys when context is cleared")
        void shouldClearMdcOnClear() {
            CorrelationContextHolder.set(
                    new CorrelationContext("corr-1", "proj-1-master", "acme.myshopify.com", "req-1"));
            CorrelationContextHolder.clear();

            assertThat(MDC.get("correlationId")).isNull();
            assertThat(MDC.get("tenantKey")).isNull();
            assertThat(MDC.get("shopDomain")).isNull();
            assertThat(MDC.get("requestId")).isNull();
        }
    }

    @Nested
    @DisplayName("enrich")
    class Enrich {

        @Test
        @DisplayName("keeps the correlation id and adds tenant and shop")
        void keepsCorrelationId() {
            CorrelationContextHolder.set(CorrelationContext.of("corr-9"));

            CorrelationContextHolder.enrich("proj-1-master", "acme.myshopify.com");

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.correlationId()).isEqualTo("corr-9");
            assertThat(ctx.tenantKey()).isEqualTo("proj-1-master");
            assertThat(MDC.get("shopDomain")).isEqualTo("acme.myshopify.com");
        }

        @Test
        @DisplayName("starts a context when none exists")
        void startsContextWhenAbsent() {
            CorrelationContextHolder.enrich("proj-1-master", null);

            var ctx = CorrelationContextHolder.get().orElseThrow();
            assertThat(ctx.correlationId()).isNotBlank();
            assertThat(ctx.shopDomain()).isNull();
            assertThat(MDC.get("shopDomain")).isNull();
        }
    }

    @Nested
    @DisplayName("runWithContext")
    class RunWithContext {

        @Test
        @DisplayName("should set context for the duration of the runnable and restore afterwards")
        void shouldSetContextAndRestore() {
            var outer = CorrelationContext.of("outer-corr");
            var inner = CorrelationContext.of("inner-corr");
            CorrelationContextHolder.set(outer);

            AtomicReference<String> captured = new AtomicReference<>();
            CorrelationContextHolder.runWithContext(inner, () -> captured.set(
                    CorrelationContextHolder.get().map(CorrelationContext::correlationId).orElse(null)));

            assertThat(captured.get()).isEqualTo("inner-corr");
            assertThat(CorrelationContextHolder.get().orElseThrow().correlationId()).isEqualTo("outer-corr");
        }

        @Test
        @DisplayName("should restore context even if runnable throws")
        void shouldRestoreOnException() {
            CorrelationContextHolder.set(CorrelationContext.of("outer-corr"));

            assertThatThrownBy(() -> CorrelationContextHolder.runWithContext(
                    CorrelationContext.of("inner-corr"), () -> {
                        throw new IllegalStateException("boom");
                    }))
                    .isInstanceOf(IllegalStateException.class);

            assertThat(CorrelationContextHolder.get().orElseThrow().correlationId()).isEqualTo("outer-corr");
        }

        @Test
        @DisplayName("should clear context after runnable when no previous context existed")
        void shouldClearWhenNoPreviousContext() {
            CorrelationContextHolder.runWithContext(CorrelationContext.of("temp"),
                    () -> assertThat(CorrelationContextHolder.get()).isPresent());

            assertThat(CorrelationContextHolder.get()).isEmpty();
        }
    }

    @Test
    @DisplayName("should not leak context across threads")
    void shouldNotLeakAcrossThreads() throws InterruptedException {
        CorrelationContextHolder.set(CorrelationContext.of("main-corr"));

        AtomicReference<Boolean> otherThreadHasContext = new AtomicReference<>();
        Thread other = new Thread(() -> otherThreadHasContext.set(CorrelationContextHolder.get().isPresent()));
        other.start();
        other.join();

        assertThat(otherThreadHasContext.get()).isFalse();
    }
}
