package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import com.flagship.gift_ledger.transfer.GiftTransaction;
import com.flagship.gift_ledger.transfer.GiftTransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class RedemptionResponse {

    @JsonProperty("transactionId")
    UUID transactionId;

    @JsonProperty("status")
    GiftTransactionStatus status;

    @JsonProperty("redeemedAt")
    Instant redeemedAt;

    @JsonProperty("gift")
    GiftSummary gift;

    public static RedemptionResponse from(GiftTransaction transaction, GiftDefinition gift) {
        return RedemptionResponse.builder()
            .transactionId(transaction.getId())
            .status(transaction.getStatus())
            .redeemedAt(transaction.getRedeemedAt())
            .gift(gift != null ? GiftSummary.of(gift) : null)
            .build();
    }
}
