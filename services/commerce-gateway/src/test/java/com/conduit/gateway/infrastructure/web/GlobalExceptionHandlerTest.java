package com.conduit.gateway.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;

import com.conduit.client.ClientConstructionException;
import com.conduit.client.OperationCancelledException;
import com.conduit.client.TenantKey;
import com.conduit.client.ratelimit.RateLimitExceededException;
import com.conduit.client.retry.RetriesExhaustedException;
import com.conduit.client.retry.UpstreamStatusException;
import com.conduit.gateway.domain.ShopNotFoundException;
import com.conduit.gateway.domain.TenantNotConfiguredException;
import com.conduit.observability.CorrelationContext;
import com.conduit.observability.CorrelationContextHolder;
import com.conduit.security.InvalidSignatureException;
import java.time.Duration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpRequestMethodNotSupportedException;

/** Exception-to-status mapping of {@link GlobalExceptionHandler}, tested as a plain unit. */
@DisplayName("GlobalExceptionHandler")
class GlobalExceptionHandlerTest {

    private static final TenantKey TENANT = TenantKey.of("proj", "master");

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @AfterEach
    void cleanup() {
        CorrelationContextHolder.clear();
    }

    @Test
    @DisplayName("maps IllegalArgumentException to 400 Bad Request")
    void handlesIllegalArgumentAsBadRequest() {
        ProblemDetail result = handler.handleIllegalArgument(new IllegalArgumentException("invalid input"));

        assertThat(result.getStatus()).isEqualTo(400);
        assertThat(result.getDetail()).isEqualTo("invalid input");
        assertThat(result.getTitle()).isEqualTo("Bad Request");
    }

    @Nested
    @DisplayName("signature failures")
    class Signatures {

        @Test
        @DisplayName("a missing header is a 400")
        void missingHeader() {
            ProblemDetail result = handler.handleInvalidSignature(
                    new InvalidSignatureException(InvalidSignatureException.Reason.MISSING_HEADER, "missing"));

            assertThat(result.getStatus()).isEqualTo(400);
        }

        @Test
        @DisplayName("a mismatch is a 401 that does not echo the reason")
        void mismatch() {
            ProblemDetail result = handler.handleInvalidSignature(
                    new InvalidSignatureException(InvalidSignatureException.Reason.MISMATCH, "computed abc"));

            assertThat(result.getStatus()).isEqualTo(401);
            assertThat(result.getDetail()).doesNotContain("abc");
        }
    }

    @Test
    @DisplayName("maps missing tenant and shop to 404")
    void notFound() {
        assertThat(handler.handleTenantNotConfigured(new TenantNotConfiguredException(TENANT)).getStatus())
                .isEqualTo(404);
        assertThat(handler.handleShopNotFound(new ShopNotFoundException(TENANT, "acme.myshopify.com")).getStatus())
                .isEqualTo(404);
    }

    @Test
    @DisplayName("maps rate-limit exhaustion to 429 with Retry-After rounded up to seconds")
    void rateLimited() {
        ResponseEntity<ProblemDetail> result = handler.handleRateLimited(
                new RateLimitExceededException("acme.myshopify.com", Duration.ofMillis(1500)));

        assertThat(result.getStatusCode().value()).isEqualTo(429);
        assertThat(result.getHeaders().getFirst(HttpHeaders.RETRY_AFTER)).isEqualTo("2");
    }

    @Test
    @DisplayName("maps exhausted retries to 502 with the last upstream status")
    void retriesExhausted() {
        ProblemDetail result = handler.handleRetriesExhausted(
                new RetriesExhaustedException(4, 503, new UpstreamStatusException(503, 4)));

        assertThat(result.getStatus()).isEqualTo(502);
        assertThat(result.getProperties()).containsEntry("attempts", 4).containsEntry("upstreamStatus", 503);
    }

    @Test
    @DisplayName("maps client construction failure to 502")
    void clientConstruction() {
        ProblemDetail result = handler.handleClientConstruction(
                new ClientConstructionException(TENANT, "factory returned no client"));

        assertThat(result.getStatus()).isEqualTo(502);
    }

    @Test
    @DisplayName("distinguishes deadline (504) from cancellation (503)")
    void cancellation() {
        assertThat(handler.handleCancelled(new OperationCancelledException("deadline", true)).getStatus())
                .isEqualTo(504);
        assertThat(handler.handleCancelled(new OperationCancelledException("cancelled", false)).getStatus())
                .isEqualTo(503);
    }

    @Test
    @DisplayName("keeps the status of Spring MVC exceptions")
    void springErrorResponse() {
        ResponseEntity<ProblemDetail> result =
                handler.handleErrorResponse(new HttpRequestMethodNotSupportedException("PATCH"));

        assertThat(result.getStatusCode().value()).isEqualTo(405);
        assertThat(result.getBody().getProperties()).containsKey("timestamp");
    }

    @Test
    @DisplayName("maps generic Exception to 500 without leaking its message")
    void handlesGenericExceptionAsInternalError() {
        ProblemDetail result = handler.handleGeneric(new RuntimeException("db password wrong"));

        assertThat(result.getStatus()).isEqualTo(500);
        assertThat(result.getDetail()).doesNotContain("password");
    }

    @Test
    @DisplayName("error response includes timestamp and correlation ID")
    void errorResponseIncludesCorrelation() {
        CorrelationContextHolder.set(CorrelationContext.of("corr-42"));

        ProblemDetail result = handler.handleGeneric(new RuntimeException("oops"));

        assertThat(result.getProperties())
                .containsKey("timestamp")
                .containsEntry("correlationId", "corr-42");
    }
}
