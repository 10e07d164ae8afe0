package com.conduit.webhook;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * JSON access to webhook payloads for handlers.
 * <p>
 * Payloads are parsed from the raw bytes only after the signature was checked, never
 * re-serialized for verification.
 */
public final class WebhookPayloads {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private WebhookPayloads() {
        // utility class
    }

    /**
     * Parses the event's payload into a JSON object tree.
     *
     * @throws WebhookHandlingException if the payload is not a JSON object
     */
    public static JsonNode parse(WebhookEvent event) {
        JsonNode node;
        try {
            node = MAPPER.readTree(event.payload());
        } catch (IOException e) {
            throw new WebhookHandlingException(event.topic(),
                    "Failed to parse %s webhook payload".formatted(event.topic()), e);
        }
        if (node == null || !node.isObject()) {
            throw new WebhookHandlingException(event.topic(),
                    "Webhook payload for %s is not a JSON object".formatted(event.topic()));
        }
        return node;
    }

    /**
     * Binds the event's payload to {@code type}; unknown properties are ignored.
     *
     * @throws WebhookHandlingException if the payload cannot be bound
     */
    public static <T> T read(WebhookEvent event, Class<T> type) {
        try {
            return MAPPER.readValue(event.payload(), type);
        } catch (IOException e) {
            throw new WebhookHandlingException(event.topic(),
                    "Failed to read %s webhook payload as %s".formatted(event.topic(), type.getSimpleName()), e);
        }
    }

    /** Text value of a top-level field, empty when absent or null. */
    public static Optional<String> text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }
}
