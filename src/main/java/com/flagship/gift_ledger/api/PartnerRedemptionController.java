package com.flagship.gift_ledger.api;

import com.flagship.gift_ledger.api.dto.PartnerStatsResponse;
import com.flagship.gift_ledger.api.dto.RedeemRequest;
import com.flagship.gift_ledger.api.dto.RedemptionResponse;
import com.flagship.gift_ledger.catalog.CatalogService;
import com.flagship.gift_ledger.transfer.GiftRedemptionService;
import com.flagship.gift_ledger.transfer.GiftTransaction;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Endpoints used by partner merchants at the point of sale.
 */
@RestController
@RequestMapping("/api/partners")
@RequiredArgsConstructor
@Slf4j
public class PartnerRedemptionController {

    private final GiftRedemptionService redemptionService;
    private final CatalogService catalogService;

    @PostMapping("/redeem")
    public ResponseEntity<RedemptionResponse> redeem(@Valid @RequestBody RedeemRequest request) {
        log.info("Received redemption request from partner {}", request.getPartnerId());

        GiftTransaction redeemed = redemptionService.redeem(request.getCode(), request.getPartnerId());
        RedemptionResponse response = RedemptionResponse.from(
            redeemed, catalogService.findById(redeemed.getGiftDefinitionId()).orElse(null));

        return ResponseEntity.ok(response);
    }

    @GetMapping("/{partyId}/stats")
    public ResponseEntity<PartnerStatsResponse> stats(@PathVariable UUID partyId) {
        return ResponseEntity.ok(PartnerStatsResponse.from(redemptionService.statsForParty(partyId)));
    }
}
