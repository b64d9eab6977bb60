package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.event.GiftRedeemedEvent;
import com.flagship.gift_ledger.exception.AlreadyRedeemedException;
import com.flagship.gift_ledger.exception.GiftLifecycleException;
import com.flagship.gift_ledger.exception.GiftNotFoundException;
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
import java.util.Locale;
import java.util.UUID;

/**
 * One-time redemption of issued gifts.
 *
 * The status read only produces a precise error for the common case; the
 * conditional UPDATE decides. When several callers race for the same code,
 * exactly one sees a row updated and every other caller gets
 * {@link AlreadyRedeemedException}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GiftRedemptionService {

    private final GiftTransactionPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final GiftMetrics giftMetrics;

    /**
     * @param codeOrTransactionId redemption code, scanned QR payload or transaction id
     * @param redeemingPartyId partner accepting the gift, may be null
     * @throws GiftNotFoundException if nothing matches
     * @throws AlreadyRedeemedException if the gift was redeemed before or concurrently
     */
    @Transactional
    public GiftTransaction redeem(String codeOrTransactionId, UUID redeemingPartyId) {
        long startNanos = System.nanoTime();
        try {
            GiftTransaction current = persistenceService.resolve(codeOrTransactionId)
                .orElseThrow(GiftNotFoundException::new);
            CorrelationContext.putGiftTransactionId(current.getId());

            GiftTransaction redeemed = current.redeem(redeemingPartyId, Instant.now().truncatedTo(ChronoUnit.MICROS));

            if (!persistenceService.markRedeemed(redeemed)) {
                log.info("Lost redemption race for gift {}", current.getId());
                throw new AlreadyRedeemedException(current.getId());
            }

            outboxService.record(GiftRedeemedEvent.fromTransaction(redeemed));

            giftMetrics.recordRedemption("success");
            log.info("Redeemed gift {} by party {}", redeemed.getId(), redeemingPartyId);
            return redeemed;

        } catch (GiftLifecycleException e) {
            giftMetrics.recordRedemption(e.getErrorCode().name().toLowerCase(Locale.ROOT));
            throw e;
        } finally {
            giftMetrics.recordLatency("redeem", Duration.ofNanos(System.nanoTime() - startNanos));
            CorrelationContext.clearLifecycleKeys();
        }
    }

    @Transactional(readOnly = true)
    public PartnerRedemptionStats statsForParty(UUID partyId) {
        if (partyId == null) {
            throw new IllegalArgumentException("Party ID is required");
        }
        return persistenceService.statsForParty(partyId);
    }
}
