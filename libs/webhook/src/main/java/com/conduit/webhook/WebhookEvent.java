package com.conduit.webhook;

import com.conduit.client.TenantKey;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;
import java.util.UUID;

/**
 * One inbound webhook delivery.
 * <p>
 * The payload is the exact raw body the signature was computed over; it is copied on the way in
 * and on the way out. Persisting events is the caller's concern.
 *
 * @param id         delivery identifier
 * @param topic      provider topic string (may be a topic no handler knows)
 * @param shopDomain originating upstream account, nullable when the header was absent
 * @param tenantKey  tenant the delivery was addressed to
 * @param payload    raw body bytes
 * @param verified   whether the signature check passed
 * @param receivedAt arrival time
 */
public record WebhookEvent(
        String id,
        String topic,
        String shopDomain,
        TenantKey tenantKey,
        byte[] payload,
        boolean verified,
        Instant receivedAt
) {

    public WebhookEvent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("topic must not be null or blank");
        }
        if (tenantKey == null) {
            throw new IllegalArgumentException("tenantKey must not be null");
        }
        if (receivedAt == null) {
            throw new IllegalArgumentException("receivedAt must not be null");
        }
        payload = payload == null ? new byte[0] : payload.clone();
    }

    /**
     * Creates an event for a delivery whose signature has been verified.
     */
    public static WebhookEvent verified(String topic, String shopDomain, TenantKey tenantKey, byte[] payload) {
        return new WebhookEvent(UUID.randomUUID().toString(), topic, shopDomain, tenantKey, payload, true, Instant.now());
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    public int payloadSize() {
        return payload.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WebhookEvent other)) {
            return false;
        }
        return verified == other.verified
                && id.equals(other.id)
                && topic.equals(other.topic)
                && Objects.equals(shopDomain, other.shopDomain)
                && tenantKey.equals(other.tenantKey)
                && Arrays.equals(payload, other.payload)
                && receivedAt.equals(other.receivedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, topic, shopDomain, tenantKey, Arrays.hashCode(payload), verified, receivedAt);
    }

    @Override
    public String toString() {
        return "WebhookEvent[id=%s, topic=%s, shop=%s, tenant=%s, bytes=%d, verified=%s]"
                .formatted(id, topic, shopDomain, tenantKey, payload.length, verified);
    }
}
