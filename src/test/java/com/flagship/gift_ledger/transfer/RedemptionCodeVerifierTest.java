package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.account.AccountService;
import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.catalog.GiftCategory;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.exception.GiftNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RedemptionCodeVerifierTest {

    private static final String CODE = "CADEAUTJE-0123456789abcdefghijklmn";
    private static final GiftDefinition CINEMA = new GiftDefinition(
        9L, "Bioscoopkaartje", "🎬", "Een avondje film", GiftCategory.ENTERTAINMENT, new BigDecimal("12.50"), true);

    @Mock
    private GiftTransactionPersistenceService persistenceService;

    @Mock
    private CatalogService catalogService;

    @Mock
    private AccountService accountService;

    @InjectMocks
    private RedemptionCodeVerifier verifier;

    private GiftTransaction issued;

    @BeforeEach
    void setUp() {
        issued = GiftTransaction.issue(UUID.randomUUID(), UUID.randomUUID(), "friend@example.com",
            CINEMA.getId(), CODE, "Veel plezier", Instant.parse("2026-04-01T18:00:00Z"));
    }

    @Test
    @DisplayName("Preview joins gift and sender display data")
    void testPreview_Issued() {
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(issued));
        when(catalogService.findById(CINEMA.getId())).thenReturn(Optional.of(CINEMA));
        when(accountService.findDisplayName(issued.getSenderAccountId())).thenReturn(Optional.of("Anna"));

        GiftPreview preview = verifier.preview(CODE);

        assertEquals(issued.getId(), preview.getTransactionId());
        assertEquals(GiftTransactionStatus.ISSUED, preview.getStatus());
        assertEquals("Bioscoopkaartje", preview.getGiftName());
        assertEquals("🎬", preview.getEmoji());
        assertEquals("Anna", preview.getSenderName());
        assertEquals("Veel plezier", preview.getMessage());
        assertFalse(preview.isRedeemed());
    }

    @Test
    @DisplayName("Redeemed gifts preview as REDEEMED")
    void testPreview_Redeemed() {
        GiftTransaction redeemed = issued.redeem(null, Instant.parse("2026-04-02T12:00:00Z"));
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(redeemed));
        when(catalogService.findById(CINEMA.getId())).thenReturn(Optional.of(CINEMA));
        when(accountService.findDisplayName(issued.getSenderAccountId())).thenReturn(Optional.of("Anna"));

        GiftPreview preview = verifier.preview(CODE);

        assertTrue(preview.isRedeemed());
        assertEquals(Instant.parse("2026-04-02T12:00:00Z"), preview.getRedeemedAt());
    }

    @Test
    @DisplayName("Unknown code is NOT_FOUND")
    void testPreview_Unknown() {
        when(persistenceService.resolve("garbage")).thenReturn(Optional.empty());

        assertThrows(GiftNotFoundException.class, () -> verifier.preview("garbage"));
    }

    @Test
    @DisplayName("Dangling gift definition is NOT_FOUND")
    void testPreview_MissingDefinition() {
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(issued));
        when(catalogService.findById(CINEMA.getId())).thenReturn(Optional.empty());

        assertThrows(GiftNotFoundException.class, () -> verifier.preview(CODE));
    }

    @Test
    @DisplayName("Dangling sender is NOT_FOUND")
    void testPreview_MissingSender() {
        when(persistenceService.resolve(CODE)).thenReturn(Optional.of(issued));
        when(catalogService.findById(CINEMA.getId())).thenReturn(Optional.of(CINEMA));
        when(accountService.findDisplayName(issued.getSenderAccountId())).thenReturn(Optional.empty());

        assertThrows(GiftNotFoundException.class, () -> verifier.preview(CODE));
    }
}
