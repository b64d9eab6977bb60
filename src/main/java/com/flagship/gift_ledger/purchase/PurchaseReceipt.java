package com.flagship.gift_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Immutable audit record of a completed purchase.
 */
@Value
public class PurchaseReceipt {

    /** Largest total {@code purchase_receipts.total_amount NUMERIC(12,2)} holds. */
    public static final BigDecimal MAX_TOTAL_AMOUNT = new BigDecimal("9999999999.99");

    UUID id;
    UUID accountId;
    List<PurchaseLineItem> items;
    BigDecimal totalAmount;
    Instant createdAt;

    /**
     * Builds a receipt whose total is the sum of its line totals.
     */
    public static PurchaseReceipt of(UUID id, UUID accountId, List<PurchaseLineItem> items, Instant createdAt) {
        if (items == null || items.isEmpty()) {
            throw new IllegalArgumentException("A receipt needs at least one line item");
        }
        BigDecimal total = items.stream()
            .map(PurchaseLineItem::lineTotal)
            .reduce(BigDecimal.ZERO, BigDecimal::add)
            .setScale(2, RoundingMode.HALF_UP);
        return new PurchaseReceipt(id, accountId, List.copyOf(items), total, createdAt);
    }

    public long totalUnits() {
        return items.stream().mapToLong(PurchaseLineItem::getQuantity).sum();
    }
}
