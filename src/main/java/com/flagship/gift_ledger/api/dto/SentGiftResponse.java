package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.transfer.GiftTransactionStatus;
import com.flagship.gift_ledger.transfer.SentGift;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class SentGiftResponse {

    @JsonProperty("transactionId")
    UUID transactionId;

    @JsonProperty("receiverEmail")
    String receiverEmail;

    @JsonProperty("message")
    String message;

    @JsonProperty("status")
    GiftTransactionStatus status;

    @JsonProperty("createdAt")
    Instant createdAt;

    @JsonProperty("redeemedAt")
    Instant redeemedAt;

    @JsonProperty("gift")
    GiftSummary gift;

    public static SentGiftResponse from(SentGift sent) {
        return SentGiftResponse.builder()
            .transactionId(sent.getTransactionId())
            .receiverEmail(sent.getReceiverEmail())
            .message(sent.getMessage())
            .status(sent.getStatus())
            .createdAt(sent.getCreatedAt())
            .redeemedAt(sent.getRedeemedAt())
            .gift(GiftSummary.withPrice(sent.getGiftName(), sent.getEmoji(), sent.getDescription(), sent.getUnitPrice()))
            .build();
    }
}
