package com.conduit.gateway.application.webhook;

import com.conduit.webhook.TopicHandler;
import com.conduit.webhook.WebhookEvent;
import com.conduit.webhook.WebhookHandlingException;
import com.conduit.webhook.WebhookPayloads;
import com.conduit.webhook.WebhookTopic;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Order lifecycle events. */
@Component
public class OrderWebhookHandler extends TopicHandler {

    private static final Logger log = LoggerFactory.getLogger(OrderWebhookHandler.class);

    public OrderWebhookHandler() {
        super(WebhookTopic.ofResource("orders"));
    }

    @Override
    public void handle(WebhookEvent event) {
        JsonNode order = WebhookPayloads.parse(event);
        String id = WebhookPayloads.text(order, "id")
                .orElseThrow(() -> new WebhookHandlingException(event.topic(), "Order payload has no id"));
        log.info("Order {} {} on {} (financial status {})",
                id,
                event.topic(),
                event.shopDomain(),
                WebhookPayloads.text(order, "financial_status").orElse("unknown"));
    }
}
