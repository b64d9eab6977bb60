package com.flagship.gift_ledger.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A lifecycle event waiting in {@code outbox_events} to be published.
 */
@Value
public class OutboxEvent {
    UUID id;
    String aggregateType;      // "Purchase" or "GiftTransaction"
    UUID aggregateId;
    String eventType;          // e.g. "GiftSent"
    String payload;            // JSON
    Instant createdAt;
    Instant publishedAt;       // null until published
    int retryCount;
    String lastError;
    Long sequenceNumber;       // assigned by the database

    public static OutboxEvent pending(String aggregateType, UUID aggregateId,
                                      String eventType, String payload) {
        return new OutboxEvent(UUID.randomUUID(), aggregateType, aggregateId, eventType,
            payload, Instant.now(), null, 0, null, null);
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
