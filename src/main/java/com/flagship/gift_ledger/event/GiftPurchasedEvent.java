package com.flagship.gift_ledger.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.flagship.gift_ledger.purchase.PurchaseLineItem;
import com.flagship.gift_ledger.purchase.PurchaseReceipt;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Published when a purchase credits an account's inventory.
 */
@Value
public class GiftPurchasedEvent implements GiftLifecycleEvent {
    UUID eventId;
    UUID purchaseId;
    UUID accountId;
    List<Line> items;
    BigDecimal totalAmount;
    Instant occurredAt;

    public static final String EVENT_TYPE = "GiftPurchased";
    public static final String AGGREGATE_TYPE = "Purchase";

    @Value
    public static class Line {
        Long giftDefinitionId;
        int quantity;
        BigDecimal unitPrice;
    }

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    @Override
    @JsonIgnore
    public UUID getAggregateId() {
        return purchaseId;
    }

    @Override
    @JsonIgnore
    public String getAggregateType() {
        return AGGREGATE_TYPE;
    }

    public static GiftPurchasedEvent fromReceipt(PurchaseReceipt receipt) {
        List<Line> lines = receipt.getItems().stream()
            .map(GiftPurchasedEvent::toLine)
            .toList();
        return new GiftPurchasedEvent(
            UUID.randomUUID(),
            receipt.getId(),
            receipt.getAccountId(),
            lines,
            receipt.getTotalAmount(),
            Instant.now()
        );
    }

    private static Line toLine(PurchaseLineItem item) {
        return new Line(item.getGiftDefinitionId(), item.getQuantity(), item.getUnitPrice());
    }
}
