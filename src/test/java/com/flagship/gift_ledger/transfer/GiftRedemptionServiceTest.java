package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.event.GiftRedeemedEvent;
import com.flagship.gift_ledger.exception.AlreadyRedeemedException;
import com.flagship.gift_ledger.exception.GiftNotFoundException;
import com.flagship.gift_ledger.observability.GiftMetrics;
import com.flagship.gift_ledger.outbox.OutboxService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GiftRedemptionServiceTest {

    private static final String CODE = "CADEAUTJE-abcdefghijklmnopqrstuvwx";

    @Mock
    private GiftTransactionPersistenceService persistenceService;

    @Mock
    private OutboxService outboxService;

    private SimpleMeterRegistry meterRegistry;
    private GiftRedemptionService redemptionService;
    private GiftTransaction issued;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        redemptionService = new GiftRedemptionService(persistenceService, outboxService, new GiftMetrics(meterRegistry));
        issued = GiftTransaction.issue(UUID.randomUUID(), UUID.randomUUID(), null, 1L, CODE, null,
            Instant.parse("2026-03-01T10:00:00Z"));
    }

    private double redemptions(String outcome) {
        return meterRegistry.counter("gift.redemptions", "outcome", outcome).count();
    }

    @Test
    @DisplayName("Issued gift is redeemed with one conditional write and one event")
    void testRedeem_Success() {
        UUID partyId = UUID.randomUUID();
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(issued));
        when(persistenceService.markRedeemed(any(GiftTransaction.class))).thenReturn(true);

        GiftTransaction redeemed = redemptionService.redeem(CODE, partyId);

        assertEquals(GiftTransactionStatus.REDEEMED, redeemed.getStatus());
        assertEquals(partyId, redeemed.getRedeemingPartyId());
        assertNotNull(redeemed.getRedeemedAt());

        ArgumentCaptor<GiftRedeemedEvent> captor = ArgumentCaptor.forClass(GiftRedeemedEvent.class);
        verify(outboxService).record(captor.capture());
        assertEquals(issued.getId(), captor.getValue().getGiftTransactionId());
        assertEquals(partyId, captor.getValue().getRedeemingPartyId());
        assertEquals(1.0, redemptions("success"));
    }

    @Test
    @DisplayName("Unknown code is NOT_FOUND")
    void testRedeem_Unknown() {
        when(persistenceService.resolve("nope")).thenReturn(Optional.empty());

        assertThrows(GiftNotFoundException.class, () -> redemptionService.redeem("nope", null));

        verify(persistenceService, never()).markRedeemed(any());
        verifyNoInteractions(outboxService);
        assertEquals(1.0, redemptions("not_found"));
    }

    @Test
    @DisplayName("Already redeemed gift is rejected without a write")
    void testRedeem_AlreadyRedeemed() {
        GiftTransaction redeemed = issued.redeem(UUID.randomUUID(), Instant.now());
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(redeemed));

        assertThrows(AlreadyRedeemedException.class, () -> redemptionService.redeem(CODE, UUID.randomUUID()));

        verify(persistenceService, never()).markRedeemed(any());
        verifyNoInteractions(outboxService);
        assertEquals(1.0, redemptions("already_redeemed"));
    }

    @Test
    @DisplayName("Losing the conditional write is ALREADY_REDEEMED")
    void testRedeem_LostRace() {
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(issued));
        when(persistenceService.markRedeemed(any(GiftTransaction.class))).thenReturn(false);

        AlreadyRedeemedException e = assertThrows(AlreadyRedeemedException.class,
            () -> redemptionService.redeem(CODE, null));

        assertEquals(issued.getId(), e.getGiftTransactionId());
        verifyNoInteractions(outboxService);
    }

    @Test
    @DisplayName("Stats require a party id")
    void testStats_RequiresParty() {
        assertThrows(IllegalArgumentException.class, () -> redemptionService.statsForParty(null));
    }
}
