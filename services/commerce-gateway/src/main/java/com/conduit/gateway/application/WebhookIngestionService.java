package com.conduit.gateway.application;

import com.conduit.client.TenantCredentials;
import com.conduit.client.TenantKey;
import com.conduit.gateway.application.port.WebhookEventLog;
import com.conduit.observability.CorrelationContextHolder;
import com.conduit.security.InvalidSignatureException;
import com.conduit.security.WebhookSignatureVerifier;
import com.conduit.webhook.DispatchResult;
import com.conduit.webhook.WebhookDispatcher;
import com.conduit.webhook.WebhookEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Accepts one raw webhook delivery: checks the headers, verifies the signature against the
 * tenant's secret, records the event and dispatches it to the registered handlers.
 */
@Service
public class WebhookIngestionService {

    private static final Logger log = LoggerFactory.getLogger(WebhookIngestionService.class);

    private final TenantCredentialsService credentialsService;
    private final WebhookSignatureVerifier verifier;
    private final WebhookEventLog eventLog;
    private final WebhookDispatcher dispatcher;

    public WebhookIngestionService(
            TenantCredentialsService credentialsService,
            WebhookSignatureVerifier verifier,
            WebhookEventLog eventLog,
            WebhookDispatcher dispatcher) {
        this.credentialsService = credentialsService;
        this.verifier = verifier;
        this.eventLog = eventLog;
        this.dispatcher = dispatcher;
    }

    /**
     * @throws InvalidSignatureException if the signature is missing or does not match
     * @throws IllegalArgumentException if the topic header is missing
     * @throws com.conduit.gateway.domain.TenantNotConfiguredException if the tenant is unknown
     */
    public DispatchResult ingest(
            TenantKey tenantKey, byte[] rawBody, String signature, String topic, String shopDomain) {
        if (signature == null || signature.isBlank()) {
            throw new InvalidSignatureException(
                    InvalidSignatureException.Reason.MISSING_HEADER, "Missing webhook signature header");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("Missing webhook topic header");
        }

        TenantCredentials credentials = credentialsService.resolve(tenantKey);
        CorrelationContextHolder.enrich(tenantKey.value(), shopDomain);
        try {
            verifier.verify(rawBody, signature, credentials.webhookSigningSecret());
        } catch (InvalidSignatureException e) {
            log.warn("Rejected webhook {} for tenant {}: {}", topic, tenantKey, e.reason());
            throw e;
        }

        WebhookEvent event = WebhookEvent.verified(topic, shopDomain, tenantKey, rawBody);
        eventLog.record(event);
        DispatchResult result = dispatcher.dispatch(event);
        log.info("Webhook {} {} for tenant {}: {} handler(s), {} failed",
                event.id(), topic, tenantKey, result.matched(), result.failed().size());
        return result;
    }
}
