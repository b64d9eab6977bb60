package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.exception.AlreadyRedeemedException;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * One transferred gift unit and its redemption code.
 *
 * Lifecycle: ISSUED on send, REDEEMED exactly once. REDEEMED is terminal.
 * {@code redeemedAt} is set if and only if the status is REDEEMED.
 */
@Value
public class GiftTransaction {

    public static final String AGGREGATE_TYPE = "GiftTransaction";

    UUID id;
    UUID senderAccountId;
    String receiverEmail;
    Long giftDefinitionId;
    String redemptionCode;
    String message;
    GiftTransactionStatus status;
    Instant createdAt;
    Instant redeemedAt;
    UUID redeemingPartyId;

    public static GiftTransaction issue(UUID id, UUID senderAccountId, String receiverEmail,
                                        Long giftDefinitionId, String redemptionCode,
                                        String message, Instant issuedAt) {
        if (redemptionCode == null || redemptionCode.isBlank()) {
            throw new IllegalArgumentException("Redemption code is required");
        }
        return new GiftTransaction(
            id,
            senderAccountId,
            receiverEmail,
            giftDefinitionId,
            redemptionCode,
            message,
            GiftTransactionStatus.ISSUED,
            issuedAt,
            null,
            null
        );
    }

    /**
     * Transitions to REDEEMED.
     *
     * @param redeemingPartyId partner that accepted the code, may be null
     * @throws AlreadyRedeemedException if this gift is already REDEEMED
     */
    public GiftTransaction redeem(UUID redeemingPartyId, Instant redeemedAt) {
        if (isRedeemed()) {
            throw new AlreadyRedeemedException(id);
        }
        if (redeemedAt == null) {
            throw new IllegalArgumentException("Redemption time is required");
        }
        return new GiftTransaction(
            id,
            senderAccountId,
            receiverEmail,
            giftDefinitionId,
            redemptionCode,
            message,
            GiftTransactionStatus.REDEEMED,
            createdAt,
            redeemedAt,
            redeemingPartyId
        );
    }

    public boolean isRedeemed() {
        return status == GiftTransactionStatus.REDEEMED;
    }
}
