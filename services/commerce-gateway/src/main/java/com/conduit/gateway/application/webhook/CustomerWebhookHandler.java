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

/** Customer events. Only the customer id is logged; the payload carries personal data. */
@Component
public class CustomerWebhookHandler extends TopicHandler {

    private static final Logger log = LoggerFactory.getLogger(CustomerWebhookHandler.class);

    public CustomerWebhookHandler() {
        super(WebhookTopic.ofResource("customers"));
    }

    @Override
    public void handle(WebhookEvent event) {
        JsonNode customer = WebhookPayloads.parse(event);
        String id = WebhookPayloads.text(customer, "id")
                .orElseThrow(() -> new WebhookHandlingException(event.topic(), "Customer payload has no id"));
        log.info("Customer {} {} on {}", id, event.topic(), event.shopDomain());
    }
}
