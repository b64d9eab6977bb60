package com.flagship.gift_ledger.exception;

/**
 * Thrown for any code or transaction id that does not resolve to a gift.
 *
 * The message never echoes whether the input was malformed or merely unknown.
 */
public class GiftNotFoundException extends GiftLifecycleException {

    public GiftNotFoundException() {
        super(GiftErrorCode.NOT_FOUND, "Gift not found");
    }
}
