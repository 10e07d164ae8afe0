package com.conduit.gateway.application.webhook;

import com.conduit.gateway.application.ShopService;
import com.conduit.webhook.TopicHandler;
import com.conduit.webhook.WebhookEvent;
import com.conduit.webhook.WebhookHandlingException;
import com.conduit.webhook.WebhookPayloads;
import com.conduit.webhook.WebhookTopic;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.EnumSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Removes the shop's stored access token once the merchant uninstalls the app. The shop comes
 * from the delivery's shop header, or from {@code myshopify_domain} in the payload.
 */
@Component
public class AppUninstalledWebhookHandler extends TopicHandler {

    private static final Logger log = LoggerFactory.getLogger(AppUninstalledWebhookHandler.class);

    private final ShopService shopService;

    public AppUninstalledWebhookHandler(ShopService shopService) {
        super(EnumSet.of(WebhookTopic.APP_UNINSTALLED));
        this.shopService = shopService;
    }

    @Override
    public void handle(WebhookEvent event) {
        String shopDomain = event.shopDomain();
        if (shopDomain == null || shopDomain.isBlank()) {
            JsonNode shop = WebhookPayloads.parse(event);
            shopDomain = WebhookPayloads.text(shop, "myshopify_domain")
                    .orElseThrow(() -> new WebhookHandlingException(event.topic(), "Cannot tell which shop uninstalled"));
        }
        if (shopService.uninstall(event.tenantKey(), shopDomain)) {
            log.info("App uninstalled from {}; access token removed", shopDomain);
        } else {
            log.info("App uninstalled from {}, which had no stored token", shopDomain);
        }
    }
}
