package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.account.AccountService;
import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.exception.GiftNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read-only lookups for recipients who want to see a gift before claiming it.
 * Never changes state.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RedemptionCodeVerifier {

    private final GiftTransactionPersistenceService persistenceService;
    private final CatalogService catalogService;
    private final AccountService accountService;

    /**
     * Unknown codes, malformed input and dangling gift or sender references
     * all raise the same {@link GiftNotFoundException}, so callers learn
     * nothing about which part failed.
     */
    @Transactional(readOnly = true)
    public GiftPreview preview(String codeOrTransactionId) {
        GiftTransaction transaction = persistenceService.resolve(codeOrTransactionId)
            .orElseThrow(GiftNotFoundException::new);
        GiftDefinition gift = catalogService.findById(transaction.getGiftDefinitionId())
            .orElseThrow(GiftNotFoundException::new);
        String senderName = accountService.findDisplayName(transaction.getSenderAccountId())
            .orElseThrow(GiftNotFoundException::new);

        log.debug("Previewed gift {} with status {}", transaction.getId(), transaction.getStatus());

        return new GiftPreview(
            transaction.getId(),
            transaction.getStatus(),
            gift.getName(),
            gift.getEmoji(),
            gift.getDescription(),
            gift.getUnitPrice(),
            senderName,
            transaction.getMessage(),
            transaction.getCreatedAt(),
            transaction.getRedeemedAt()
        );
    }
}
