package com.conduit.webhook;

import com.conduit.observability.MetricFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Fans a verified webhook event out to every registered handler whose topic matches.
 * <p>
 * Each dispatch iterates over a copy of the handler list taken under the read lock, so a
 * registration racing with a dispatch never changes the fan-out in progress. A handler that
 * throws, from its topic predicate or while handling, is logged and counted; the remaining
 * handlers still run and the dispatch itself never fails. An event no handler wants is logged and still counts as received.
 */
public class WebhookDispatcher {

    private static final Logger log = LoggerFactory.getLogger(WebhookDispatcher.class);

    private final List<WebhookHandler> handlers = new ArrayList<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final MetricFactory metrics;

    public WebhookDispatcher(MetricFactory metrics) {
        if (metrics == null) {
            throw new IllegalArgumentException("metrics must not be null");
        }
        this.metrics = metrics;
    }

    /**
     * Appends a handler. Safe to call while dispatches are running.
     */
    public void registerHandler(WebhookHandler handler) {
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        lock.writeLock().lock();
        try {
            handlers.add(handler);
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Registered webhook handler {}", handler.name());
    }

    /**
     * Invokes every matching handler in registration order.
     */
    public DispatchResult dispatch(WebhookEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event must not be null");
        }
        List<WebhookHandler> snapshot = snapshot();
        List<String> succeeded = new ArrayList<>();
        List<String> failed = new ArrayList<>();

        for (WebhookHandler handler : snapshot) {
            try {
                if (!handler.canHandle(event.topic())) {
                    continue;
                }
                handler.handle(event);
                succeeded.add(handler.name());
                log.info("Webhook {} handled by {}", event.topic(), handler.name());
            } catch (RuntimeException e) {
                failed.add(handler.name());
                metrics.counter("conduit.webhook.handler.failures", "Webhook handler failures",
                        "handler", handler.name()).increment();
                log.error("Webhook handler {} failed for topic {} (event {})",
                        handler.name(), event.topic(), event.id(), e);
            }
        }

        DispatchResult result = new DispatchResult(event.topic(), succeeded, failed);
        if (result.unhandled()) {
            metrics.counter("conduit.webhook.unhandled", "Webhook events no handler matched").increment();
            log.warn("No handler found for webhook topic {} (event {})", event.topic(), event.id());
        } else {
            metrics.counter("conduit.webhook.dispatched", "Webhook events dispatched to handlers",
                    MetricFactory.TAG_TOPIC, event.topic()).increment();
        }
        return result;
    }

    public int handlerCount() {
        lock.readLock().lock();
        try {
            return handlers.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private List<WebhookHandler> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(handlers);
        } finally {
            lock.readLock().unlock();
        }
    }
}
