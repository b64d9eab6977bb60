package com.flagship.gift_ledger.transfer;

import com.flagship.gift_ledger.catalog.GiftDefinition;
import lombok.Value;

/**
 * Result of a send: the ISSUED transaction, which carries the redemption
 * code, and the gift it transfers.
 */
@Value
public class IssuedGift {
    GiftTransaction transaction;
    GiftDefinition gift;

    public String getRedemptionCode() {
        return transaction.getRedemptionCode();
    }
}
