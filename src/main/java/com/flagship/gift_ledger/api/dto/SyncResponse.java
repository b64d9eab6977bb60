package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.sync.SyncSnapshot;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class SyncResponse {

    @JsonProperty("inventory")
    List<InventoryItemResponse> inventory;

    @JsonProperty("recentSent")
    List<SentGiftResponse> recentSent;

    @JsonProperty("syncTime")
    Instant syncTime;

    public static SyncResponse from(SyncSnapshot snapshot) {
        return SyncResponse.builder()
            .inventory(snapshot.getInventory().stream().map(InventoryItemResponse::from).toList())
            .recentSent(snapshot.getRecentSent().stream().map(SentGiftResponse::from).toList())
            .syncTime(snapshot.getSyncTime())
            .build();
    }
}
