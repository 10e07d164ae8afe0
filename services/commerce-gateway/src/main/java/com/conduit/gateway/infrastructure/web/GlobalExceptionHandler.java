package com.conduit.gateway.infrastructure.web;

import com.conduit.client.ClientConstructionException;
import com.conduit.client.OperationCancelledException;
import com.conduit.client.ratelimit.RateLimitExceededException;
import com.conduit.client.retry.RetriesExhaustedException;
import com.conduit.gateway.domain.ShopNotFoundException;
import com.conduit.gateway.domain.TenantNotConfiguredException;
import com.conduit.observability.CorrelationContextHolder;
import com.conduit.security.InvalidSignatureException;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.client.RestClientException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://conduit.dev/errors/rate-limited",
 *   "title": "Too Many Requests",
 *   "status": 429,
 *   "detail": "Rate limit for 'acme.myshopify.com' not available within PT1M",
 *   "timestamp": "2025-07-12T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every response carries the correlation ID so that an error can be traced to its log lines.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String TYPE_BASE = "https://conduit.dev/errors/";

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "Request could not be read");
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ProblemDetail handleInvalidSignature(InvalidSignatureException ex) {
        if (ex.reason() == InvalidSignatureException.Reason.MISSING_HEADER) {
            return problem(HttpStatus.BAD_REQUEST, "Bad Request", "missing-signature", ex.getMessage());
        }
        return problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "invalid-signature", "Webhook signature is invalid");
    }

    @ExceptionHandler(TenantNotConfiguredException.class)
    public ProblemDetail handleTenantNotConfigured(TenantNotConfiguredException ex) {
        log.warn("{}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Tenant Not Configured", "tenant-not-configured", ex.getMessage());
    }

    @ExceptionHandler(ShopNotFoundException.class)
    public ProblemDetail handleShopNotFound(ShopNotFoundException ex) {
        log.warn("{}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, "Shop Not Found", "shop-not-found", ex.getMessage());
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ProblemDetail> handleRateLimited(RateLimitExceededException ex) {
        ProblemDetail problem =
                problem(HttpStatus.TOO_MANY_REQUESTS, "Too Many Requests", "rate-limited", ex.getMessage());
        long retryAfterSeconds = Math.max(1, (ex.retryAfter().toMillis() + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, Long.toString(retryAfterSeconds))
                .body(problem);
    }

    @ExceptionHandler(RetriesExhaustedException.class)
    public ProblemDetail handleRetriesExhausted(RetriesExhaustedException ex) {
        ProblemDetail problem = problem(HttpStatus.BAD_GATEWAY, "Bad Gateway", "upstream-unavailable", ex.getMessage());
        problem.setProperty("attempts", ex.attempts());
        ex.lastStatus().ifPresent(status -> problem.setProperty("upstreamStatus", status));
        return problem;
    }

    @ExceptionHandler(ClientConstructionException.class)
    public ProblemDetail handleClientConstruction(ClientConstructionException ex) {
        log.error("Client construction failed for tenant {}", ex.tenantKey(), ex);
        return problem(HttpStatus.BAD_GATEWAY, "Bad Gateway", "client-construction", ex.getMessage());
    }

    @ExceptionHandler(RestClientException.class)
    public ProblemDetail handleRestClient(RestClientException ex) {
        log.error("Upstream call failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Bad Gateway", "upstream-error", "Upstream call failed");
    }

    @ExceptionHandler(OperationCancelledException.class)
    public ProblemDetail handleCancelled(OperationCancelledException ex) {
        if (ex.deadlineExceeded()) {
            log.warn("Request deadline exceeded: {}", ex.getMessage());
            return problem(HttpStatus.GATEWAY_TIMEOUT, "Gateway Timeout", "deadline-exceeded", ex.getMessage());
        }
        log.info("Request cancelled: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service Unavailable", "cancelled", ex.getMessage());
    }

    /** Spring MVC's own exceptions keep the status they declare. */
    @ExceptionHandler({
        ServletRequestBindingException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        NoResourceFoundException.class
    })
    public ResponseEntity<ProblemDetail> handleErrorResponse(Exception ex) {
        ErrorResponse error = (ErrorResponse) ex;
        HttpStatusCode status = error.getStatusCode();
        ProblemDetail problem = error.getBody();
        enrichWithCorrelation(problem);
        return ResponseEntity.status(status).headers(error.getHeaders()).body(problem);
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal", "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(TYPE_BASE + type));
        enrichWithCorrelation(problem);
        return problem;
    }

    private void enrichWithCorrelation(ProblemDetail problem) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
    }
}
