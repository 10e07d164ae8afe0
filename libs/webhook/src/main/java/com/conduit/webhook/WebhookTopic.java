package com.conduit.webhook;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Webhook topics the platform subscribes to. The {@code value} is the provider's topic string
 * as sent in the topic header.
 */
public enum WebhookTopic {

    // ---- Orders ----
    ORDERS_CREATE("orders/create"),
    ORDERS_UPDATED("orders/updated"),
    ORDERS_CANCELLED("orders/cancelled"),
    ORDERS_PAID("orders/paid"),
    ORDERS_FULFILLED("orders/fulfilled"),
    ORDERS_PARTIALLY_FULFILLED("orders/partially_fulfilled"),

    // ---- Products ----
    PRODUCTS_CREATE("products/create"),
    PRODUCTS_UPDATE("products/update"),
    PRODUCTS_DELETE("products/delete"),

    // ---- Customers ----
    CUSTOMERS_CREATE("customers/create"),
    CUSTOMERS_UPDATE("customers/update"),
    CUSTOMERS_DELETE("customers/delete"),
    CUSTOMERS_ENABLE("customers/enable"),
    CUSTOMERS_DISABLE("customers/disable"),

    // ---- App lifecycle ----
    APP_UNINSTALLED("app/uninstalled");

    private final String value;

    WebhookTopic(String value) {
        this.value = value;
    }

    /** The provider's topic string (e.g. "orders/create"). */
    public String value() {
        return value;
    }

    /** Resource part of the topic, e.g. "orders". */
    public String resource() {
        return value.substring(0, value.indexOf('/'));
    }

    public static Optional<WebhookTopic> fromString(String value) {
        for (WebhookTopic topic : values()) {
            if (topic.value.equals(value)) {
                return Optional.of(topic);
            }
        }
        return Optional.empty();
    }

    public static boolean isKnown(String value) {
        return fromString(value).isPresent();
    }

    /**
     * All topics of one resource, e.g. every {@code orders/*} topic.
     */
    public static Set<WebhookTopic> ofResource(String resource) {
        Set<WebhookTopic> topics = EnumSet.noneOf(WebhookTopic.class);
        for (WebhookTopic topic : values()) {
            if (topic.resource().equals(resource)) {
                topics.add(topic);
            }
        }
        return topics;
    }
}
