package com.flagship.gift_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.gift_ledger.transfer.GiftTransaction;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published once per gift, when its code is redeemed.
 */
@Value
public class GiftRedeemedEvent implements GiftLifecycleEvent {
    UUID eventId;
    UUID giftTransactionId;
    UUID senderAccountId;
    Long giftDefinitionId;
    UUID redeemingPartyId;
    Instant redeemedAt;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GiftRedeemed";

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

    public static GiftRedeemedEvent fromTransaction(GiftTransaction transaction) {
        return new GiftRedeemedEvent(
            UUID.randomUUID(),
            transaction.getId(),
            transaction.getSenderAccountId(),
            transaction.getGiftDefinitionId(),
            transaction.getRedeemingPartyId(),
            transaction.getRedeemedAt(),
            Instant.now()
        );
    }
}
