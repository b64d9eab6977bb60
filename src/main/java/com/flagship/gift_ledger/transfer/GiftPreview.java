package com.flagship.gift_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * What a recipient sees before claiming: the gift, who sent it and whether
 * it is still redeemable.
 */
@Value
public class GiftPreview {
    UUID transactionId;
    GiftTransactionStatus status;
    String giftName;
    String emoji;
    String description;
    BigDecimal unitPrice;
    String senderName;
    String message;
    Instant createdAt;
    Instant redeemedAt;

    public boolean isRedeemed() {
        return status == GiftTransactionStatus.REDEEMED;
    }
}
