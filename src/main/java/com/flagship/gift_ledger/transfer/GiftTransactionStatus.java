package com.flagship.gift_ledger.transfer;

public enum GiftTransactionStatus {
    ISSUED,
    REDEEMED
}
