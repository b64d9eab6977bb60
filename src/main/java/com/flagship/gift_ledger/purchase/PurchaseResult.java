package com.flagship.gift_ledger.purchase;

import lombok.Value;

/**
 * A receipt plus whether it was replayed for a repeated idempotency key.
 */
@Value
public class PurchaseResult {
    PurchaseReceipt receipt;
    boolean replayed;
}
