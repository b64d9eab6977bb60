package com.flagship.gift_ledger.exception;

/**
 * Base type for recoverable gift lifecycle failures.
 *
 * Thrown inside a transactional boundary, it rolls back every partial effect
 * of the operation before reaching the caller.
 */
public abstract class GiftLifecycleException extends RuntimeException {

    private final GiftErrorCode errorCode;

    protected GiftLifecycleException(GiftErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public GiftErrorCode getErrorCode() {
        return errorCode;
    }
}
