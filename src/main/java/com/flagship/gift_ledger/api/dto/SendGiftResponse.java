package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.UUID;

/**
 * {@code qrCode} is the payload a client renders as a QR image;
 * {@code claimUrl} is the link shared with the recipient.
 */
@Value
@Builder
public class SendGiftResponse {

    @JsonProperty("transactionId")
    UUID transactionId;

    @JsonProperty("gift")
    GiftSummary gift;

    @JsonProperty("qrCode")
    String qrCode;

    @JsonProperty("claimUrl")
    String claimUrl;
}
