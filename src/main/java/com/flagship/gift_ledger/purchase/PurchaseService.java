package com.flagship.gift_ledger.purchase;

import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.event.GiftPurchasedEvent;
import com.flagship.gift_ledger.exception.GiftLifecycleException;
import com.flagship.gift_ledger.exception.InvalidItemException;
import com.flagship.gift_ledger.inventory.InventoryLedgerService;
import com.flagship.gift_ledger.observability.CorrelationContext;
import com.flagship.gift_ledger.observability.GiftMetrics;
import com.flagship.gift_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Converts a priced basket into inventory credits and a receipt.
 *
 * The credits, the receipt and the {@code GiftPurchased} outbox event share
 * one transaction. Every line is validated before the first credit, so an
 * invalid line never leaves partial credits behind, and any later failure
 * rolls all of them back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PurchaseService {

    /** Width of {@code purchase_receipts.idempotency_key}. */
    static final int MAX_IDEMPOTENCY_KEY_LENGTH = 255;

    private final CatalogService catalogService;
    private final InventoryLedgerService inventoryLedger;
    private final PurchaseReceiptRepository receiptRepository;
    private final IdempotencyService idempotencyService;
    private final OutboxService outboxService;
    private final GiftMetrics giftMetrics;

    /**
     * @throws InvalidItemException if the basket is empty, a quantity is not
     *         positive, a gift definition is unknown or inactive, or the
     *         total or a resulting holding is too large to record
     */
    @Transactional
    public PurchaseReceipt purchase(UUID accountId, List<PurchaseItem> items) {
        return purchase(accountId, items, null).getReceipt();
    }

    /**
     * Same as {@link #purchase(UUID, List)}, but a repeated
     * {@code idempotencyKey} returns the original receipt without crediting
     * again. Of two concurrent first uses of a key, the later one fails with
     * {@link org.springframework.dao.DataIntegrityViolationException} and
     * leaves no trace; retrying it replays the winner.
     *
     * @param idempotencyKey optional client key of at most 255 characters,
     *        null or blank to disable
     */
    @Transactional
    public PurchaseResult purchase(UUID accountId, List<PurchaseItem> items, String idempotencyKey) {
        if (accountId == null) {
            throw new IllegalArgumentException("Account ID is required");
        }
        String key = idempotencyKey == null || idempotencyKey.isBlank() ? null : idempotencyKey;
        if (key != null && key.length() > MAX_IDEMPOTENCY_KEY_LENGTH) {
            throw new IllegalArgumentException(
                "Idempotency key must not exceed " + MAX_IDEMPOTENCY_KEY_LENGTH + " characters");
        }
        long startNanos = System.nanoTime();
        CorrelationContext.putAccountId(accountId);

        try {
            if (key != null) {
                Optional<PurchaseReceipt> existing = findReplay(accountId, key);
                if (existing.isPresent()) {
                    giftMetrics.recordIdempotencyHit();
                    log.info("Idempotency key already used, returning purchase {}", existing.get().getId());
                    return new PurchaseResult(existing.get(), true);
                }
                giftMetrics.recordIdempotencyMiss();
            }

            List<PurchaseLineItem> lines = priceLines(items);

            for (PurchaseLineItem line : lines) {
                inventoryLedger.credit(accountId, line.getGiftDefinitionId(), line.getQuantity());
            }

            PurchaseReceipt receipt = PurchaseReceipt.of(
                UUID.randomUUID(), accountId, lines, Instant.now().truncatedTo(ChronoUnit.MICROS));
            // Flushed here so a concurrent purchase with the same key fails on the unique index now
            receiptRepository.saveAndFlush(PurchaseReceiptEntity.fromDomain(receipt, key));
            outboxService.record(GiftPurchasedEvent.fromReceipt(receipt));

            if (key != null) {
                rememberAfterCommit(key, receipt.getId());
            }

            giftMetrics.recordPurchase(receipt.totalUnits());
            log.info("Purchase {} completed: lines={}, units={}, total={}",
                receipt.getId(), lines.size(), receipt.totalUnits(), receipt.getTotalAmount());

            return new PurchaseResult(receipt, false);

        } catch (GiftLifecycleException e) {
            giftMetrics.recordRejected("purchase", e.getErrorCode().name());
            log.info("Purchase rejected: {}", e.getMessage());
            throw e;
        } finally {
            giftMetrics.recordLatency("purchase", Duration.ofNanos(System.nanoTime() - startNanos));
            CorrelationContext.clearLifecycleKeys();
        }
    }

    @Transactional(readOnly = true)
    public List<PurchaseReceipt> purchaseHistory(UUID accountId) {
        return receiptRepository.findByAccountIdOrderByCreatedAtDesc(accountId)
            .stream()
            .map(PurchaseReceiptEntity::toDomain)
            .toList();
    }

    private Optional<PurchaseReceipt> findReplay(UUID accountId, String key) {
        Optional<UUID> receiptId = idempotencyService.findReceiptId(key);
        if (receiptId.isEmpty()) {
            return Optional.empty();
        }
        PurchaseReceipt receipt = receiptRepository.findById(receiptId.get())
            .map(PurchaseReceiptEntity::toDomain)
            .orElseThrow(() -> new IllegalStateException(
                "Receipt found by idempotency key but not by ID: " + receiptId.get()));
        if (!receipt.getAccountId().equals(accountId)) {
            throw new IllegalArgumentException("Idempotency key already used by another account");
        }
        return Optional.of(receipt);
    }

    /**
     * Validates every line and captures its current price. No side effects.
     */
    private List<PurchaseLineItem> priceLines(List<PurchaseItem> items) {
        if (items == null || items.isEmpty()) {
            throw new InvalidItemException(null, "At least one item is required");
        }
        List<PurchaseLineItem> lines = new ArrayList<>(items.size());
        BigDecimal total = BigDecimal.ZERO;
        for (PurchaseItem item : items) {
            if (item == null) {
                throw new InvalidItemException(null, "Purchase item cannot be null");
            }
            if (item.getQuantity() == null || item.getQuantity() <= 0) {
                throw InvalidItemException.nonPositiveQuantity(item.getGiftDefinitionId(), item.getQuantity());
            }
            GiftDefinition definition = catalogService.findActive(item.getGiftDefinitionId())
                .orElseThrow(() -> InvalidItemException.unknownGift(item.getGiftDefinitionId()));
            PurchaseLineItem line = new PurchaseLineItem(definition.getId(), item.getQuantity(), definition.getUnitPrice());
            total = total.add(line.lineTotal());
            if (total.compareTo(PurchaseReceipt.MAX_TOTAL_AMOUNT) > 0) {
                throw InvalidItemException.totalTooLarge(total, PurchaseReceipt.MAX_TOTAL_AMOUNT);
            }
            lines.add(line);
        }
        return lines;
    }

    private void rememberAfterCommit(String key, UUID receiptId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.remember(key, receiptId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.remember(key, receiptId);
            }
        });
    }
}
