package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.event.GiftSentEvent;
import com.flagship.gift_ledger.exception.GiftLifecycleException;
import com.flagship.gift_ledger.exception.InsufficientBalanceException;
import com.flagship.gift_ledger.exception.InvalidItemException;
import com.flagship.gift_ledger.inventory.InventoryLedgerService;
import com.flagship.gift_ledger.observability.CorrelationContext;
import com.flagship.gift_ledger.observability.GiftMetrics;
import com.flagship.gift_ledger.outbox.OutboxService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Moves one gift unit out of the sender's inventory into a new ISSUED
 * gift transaction with a fresh redemption code.
 *
 * Debit, transaction row and {@code GiftSent} outbox event commit together;
 * a failure at any step restores the sender's unit.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GiftTransferService {

    private final CatalogService catalogService;
    private final InventoryLedgerService inventoryLedger;
    private final GiftTransactionPersistenceService persistenceService;
    private final RedemptionCodeGenerator codeGenerator;
    private final OutboxService outboxService;
    private final GiftMetrics giftMetrics;

    /**
     * @param receiverEmail optional, stored lower-cased
     * @param message optional personal note
     * @throws InvalidItemException if the gift definition does not exist
     * @throws InsufficientBalanceException if the sender holds no unit of it
     */
    @Transactional
    public IssuedGift send(UUID senderAccountId, Long giftDefinitionId, String receiverEmail, String message) {
        if (senderAccountId == null) {
            throw new IllegalArgumentException("Sender account ID is required");
        }
        long startNanos = System.nanoTime();
        CorrelationContext.putAccountId(senderAccountId);

        try {
            GiftDefinition gift = catalogService.findById(giftDefinitionId)
                .orElseThrow(() -> InvalidItemException.unknownGift(giftDefinitionId));

            inventoryLedger.debit(senderAccountId, gift.getId(), 1);

            GiftTransaction issued = GiftTransaction.issue(
                UUID.randomUUID(),
                senderAccountId,
                normalizeEmail(receiverEmail),
                gift.getId(),
                codeGenerator.nextCode(),
                blankToNull(message),
                Instant.now().truncatedTo(ChronoUnit.MICROS)
            );
            CorrelationContext.putGiftTransactionId(issued.getId());

            GiftTransaction saved = persistenceService.save(issued);
            outboxService.record(GiftSentEvent.fromTransaction(saved));

            giftMetrics.recordGiftSent();
            log.info("Sent gift {} ({}) from account {}", saved.getId(), gift.getName(), senderAccountId);

            return new IssuedGift(saved, gift);

        } catch (GiftLifecycleException e) {
            giftMetrics.recordRejected("send", e.getErrorCode().name());
            log.info("Send rejected: {}", e.getMessage());
            throw e;
        } finally {
            giftMetrics.recordLatency("send", Duration.ofNanos(System.nanoTime() - startNanos));
            CorrelationContext.clearLifecycleKeys();
        }
    }

    /**
     * Gifts sent by the account, newest first, with their current status.
     *
     * @param limit maximum entries, or 0 for the full history
     */
    @Transactional(readOnly = true)
    public List<SentGift> sentHistory(UUID senderAccountId, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + limit);
        }
        return persistenceService.findSentBy(senderAccountId, limit);
    }

    private static String normalizeEmail(String email) {
        String trimmed = blankToNull(email);
        return trimmed != null ? trimmed.toLowerCase(Locale.ROOT) : null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
