package com.conduit.webhook;

/**
 * Thrown by a {@link WebhookHandler} that cannot process an event. Terminal inside the
 * dispatcher: it is logged and counted, never propagated to the webhook sender.
 */
public class WebhookHandlingException extends RuntimeException {

    private final String topic;

    public WebhookHandlingException(String topic, String message) {
        super(message);
        this.topic = topic;
    }

    public WebhookHandlingException(String topic, String message, Throwable cause) {
        super(message, cause);
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
