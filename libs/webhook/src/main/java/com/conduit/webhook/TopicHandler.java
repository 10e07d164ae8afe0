package com.conduit.webhook;

import java.util.EnumSet;
import java.util.Set;

/**
 * Base for handlers bound to a fixed set of {@link WebhookTopic}s.
 */
public abstract class TopicHandler implements WebhookHandler {

    private final Set<WebhookTopic> topics;

    protected TopicHandler(Set<WebhookTopic> topics) {
        if (topics == null || topics.isEmpty()) {
            throw new IllegalArgumentException("topics must not be null or empty");
        }
        this.topics = EnumSet.copyOf(topics);
    }

    @Override
    public boolean canHandle(String topic) {
        return WebhookTopic.fromString(topic).map(topics::contains).orElse(false);
    }
}
