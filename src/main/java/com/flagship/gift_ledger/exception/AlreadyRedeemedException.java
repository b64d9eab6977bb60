package com.flagship.gift_ledger.exception;

import java.util.UUID;

/**
 * Thrown when a redemption targets a gift that is already redeemed,
 * including the losers of a concurrent redemption race.
 */
public class AlreadyRedeemedException extends GiftLifecycleException {

    private final UUID giftTransactionId;

    public AlreadyRedeemedException(UUID giftTransactionId) {
        super(GiftErrorCode.ALREADY_REDEEMED, "Gift already redeemed");
        this.giftTransactionId = giftTransactionId;
    }

    public UUID getGiftTransactionId() {
        return giftTransactionId;
    }
}
