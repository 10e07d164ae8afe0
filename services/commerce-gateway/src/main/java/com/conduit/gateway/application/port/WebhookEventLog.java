package com.conduit.gateway.application.port;

import com.conduit.webhook.WebhookEvent;
import java.util.List;
import java.util.Optional;

/** Record of received webhook deliveries. */
public interface WebhookEventLog {

    void record(WebhookEvent event);

    Optional<WebhookEvent> findById(String id);

    /** Most recent events first, at most {@code limit}. */
    List<WebhookEvent> recent(int limit);
}
