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

@Component
public class ProductWebhookHandler extends TopicHandler {

    private static final Logger log = LoggerFactory.getLogger(ProductWebhookHandler.class);

    public ProductWebhookHandler() {
        super(WebhookTopic.ofResource("products"));
    }

    @Override
    public void handle(WebhookEvent event) {
        JsonNode product = WebhookPayloads.parse(event);
        String id = WebhookPayloads.text(product, "id")
                .orElseThrow(() -> new WebhookHandlingException(event.topic(), "Product payload has no id"));
        log.info("Product {} {} on {}", id, event.topic(), event.shopDomain());
    }
}
