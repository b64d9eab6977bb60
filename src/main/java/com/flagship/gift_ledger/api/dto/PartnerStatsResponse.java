package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.transfer.PartnerRedemptionStats;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PartnerStatsResponse {

    @JsonProperty("partnerId")
    UUID partnerId;

    @JsonProperty("redemptionCount")
    long redemptionCount;

    @JsonProperty("totalValue")
    BigDecimal totalValue;

    @JsonProperty("lastRedeemedAt")
    Instant lastRedeemedAt;

    public static PartnerStatsResponse from(PartnerRedemptionStats stats) {
        return PartnerStatsResponse.builder()
            .partnerId(stats.getPartyId())
            .redemptionCount(stats.getRedemptionCount())
            .totalValue(stats.getTotalValue())
            .lastRedeemedAt(stats.getLastRedeemedAt())
            .build();
    }
}
