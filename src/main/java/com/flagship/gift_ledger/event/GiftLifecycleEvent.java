package com.flagship.gift_ledger.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Fact recorded when a gift changes hands or state.
 *
 * Events are written to the outbox in the same transaction as the change
 * they describe, so a consumer never sees an event for a rolled-back change.
 */
public interface GiftLifecycleEvent {

    /**
     * Unique per event instance; consumers deduplicate on it.
     */
    UUID getEventId();

    /**
     * Id of the purchase receipt or gift transaction the event is about.
     */
    UUID getAggregateId();

    String getAggregateType();

    Instant getOccurredAt();

    String getEventType();
}
