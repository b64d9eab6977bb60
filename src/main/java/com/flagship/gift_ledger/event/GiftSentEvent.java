package com.flagship.gift_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.gift_ledger.transfer.GiftTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published when a unit leaves the sender's inventory and a redemption code
 * is issued. The code itself is not part of the payload.
 */
@Value
public class GiftSentEvent implements GiftLifecycleEvent {
    UUID eventId;
    UUID giftTransactionId;
    UUID senderAccountId;
    String receiverEmail;
    Long giftDefinitionId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GiftSent";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return giftTransactionId;
    }

    @Override
    @JsonIgnore
    public String getAggregateType() {
        return GiftTransaction.AGGREGATE_TYPE;
    }

    public static GiftSentEvent fromTransaction(GiftTransaction transaction) {
        return new GiftSentEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getSenderAccountId(),
            transaction.getReceiverEmail(),
            transaction.getGiftDefinitionId(),
            Instant.now()
        );
    }
}
