package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.transfer.GiftPreview;
import com.flagship.gift_ledger.transfer.GiftTransactionStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class GiftPreviewResponse {

    @JsonProperty("transactionId")
    UUID transactionId;

    @JsonProperty("status")
    GiftTransactionStatus status;

    @JsonProperty("gift")
    GiftSummary gift;

    @JsonProperty("senderName")
    String senderName;

    @JsonProperty("message")
    String message;

    @JsonProperty("createdAt")
    Instant createdAt;

    public static GiftPreviewResponse from(GiftPreview preview) {
        return GiftPreviewResponse.builder()
            .transactionId(preview.getTransactionId())
            .status(preview.getStatus())
            .gift(GiftSummary.withPrice(preview.getGiftName(), preview.getEmoji(),
                preview.getDescription(), preview.getUnitPrice()))
            .senderName(preview.getSenderName())
            .message(preview.getMessage())
            .createdAt(preview.getCreatedAt())
            .build();
    }
}
