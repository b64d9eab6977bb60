package com.flagship.gift_ledger.purchase;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Embeddable;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JPA mapping of {@code purchase_receipts} and its {@code purchase_line_items}.
 *
 * Both tables are append-only (a trigger rejects UPDATE and DELETE), so every
 * column is {@code updatable = false} and the entity has no mutators.
 */
@Entity
@Table(name = "purchase_receipts")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PurchaseReceiptEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "account_id", nullable = false, updatable = false)
    private UUID accountId;

    @Column(name = "total_amount", nullable = false, updatable = false, precision = 12, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "idempotency_key", updatable = false, unique = true)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "purchase_line_items", joinColumns = @JoinColumn(name = "purchase_id"))
    @OrderColumn(name = "line_number")
    private List<LineItem> items = new ArrayList<>();

    @Embeddable
    @Getter
    @NoArgsConstructor(access = AccessLevel.PROTECTED)
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class LineItem {

        @Column(name = "gift_definition_id", nullable = false, updatable = false)
        private Long giftDefinitionId;

        @Column(nullable = false, updatable = false)
        private int quantity;

        @Column(name = "unit_price", nullable = false, updatable = false, precision = 10, scale = 2)
        private BigDecimal unitPrice;

        static LineItem fromDomain(PurchaseLineItem item) {
            return new LineItem(item.getGiftDefinitionId(), item.getQuantity(), item.getUnitPrice());
        }

        PurchaseLineItem toDomain() {
            return new PurchaseLineItem(giftDefinitionId, quantity, unitPrice);
        }
    }

    /**
     * @param idempotencyKey client-supplied key, may be null
     */
    public static PurchaseReceiptEntity fromDomain(PurchaseReceipt receipt, String idempotencyKey) {
        List<LineItem> lines = new ArrayList<>();
        for (PurchaseLineItem item : receipt.getItems()) {
            lines.add(LineItem.fromDomain(item));
        }
        return new PurchaseReceiptEntity(
            receipt.getId(),
            receipt.getAccountId(),
            receipt.getTotalAmount(),
            idempotencyKey,
            receipt.getCreatedAt(),
            lines
        );
    }

    public PurchaseReceipt toDomain() {
        List<PurchaseLineItem> lines = items.stream()
            .map(LineItem::toDomain)
            .toList();
        return new PurchaseReceipt(id, accountId, lines, totalAmount, createdAt);
    }
}
