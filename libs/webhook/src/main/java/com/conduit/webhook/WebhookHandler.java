package com.conduit.webhook;

/**
 * A consumer of webhook events for one or more topics.
 */
public interface WebhookHandler {

    /** Whether this handler wants events of {@code topic}. */
    boolean canHandle(String topic);

    /**
     * Processes one event.
     *
     * @throws WebhookHandlingException if the event cannot be processed
     */
    void handle(WebhookEvent event);

    /** Name used in logs, metrics and dispatch results. */
    default String name() {
        String simpleName = getClass().getSimpleName();
        return simpleName.isEmpty() ? getClass().getName() : simpleName;
    }
}
