package com.conduit.gateway.infrastructure.persistence;

import com.conduit.gateway.application.port.WebhookEventLog;
import com.conduit.webhook.WebhookEvent;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/** Bounded in-memory event log; the oldest events are dropped past {@value #CAPACITY}. */
@Repository
public class InMemoryWebhookEventLog implements WebhookEventLog {

    static final int CAPACITY = 1_000;

    private final Deque<WebhookEvent> events = new ArrayDeque<>();

    @Override
    public synchronized void record(WebhookEvent event) {
        events.addFirst(event);
        while (events.size() > CAPACITY) {
            events.removeLast();
        }
    }

    @Override
    public synchronized Optional<WebhookEvent> findById(String id) {
        return events.stream().filter(e -> e.id().equals(id)).findFirst();
    }

    @Override
    public synchronized List<WebhookEvent> recent(int limit) {
        List<WebhookEvent> result = new ArrayList<>(Math.min(limit, events.size()));
        Iterator<WebhookEvent> it = events.iterator();
        while (it.hasNext() && result.size() < limit) {
            result.add(it.next());
        }
        return result;
    }
}
