package com.flagship.gift_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A row of an account's sent history with the gift's display fields.
 * The redemption code is deliberately absent.
 */
@Value
public class SentGift {
    UUID transactionId;
    String receiverEmail;
    String message;
    GiftTransactionStatus status;
    Instant createdAt;
    Instant redeemedAt;
    Long giftDefinitionId;
    String giftName;
    String emoji;
    String description;
    BigDecimal unitPrice;
}
