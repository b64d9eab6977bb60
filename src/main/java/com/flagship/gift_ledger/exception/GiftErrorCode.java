package com.flagship.gift_ledger.exception;

import org.springframework.http.HttpStatus;

/**
 * Error categories of the gift lifecycle.
 *
 * Each category maps to a distinct HTTP status so callers can tell
 * "bad request" apart from "this code is dead" and "try again".
 */
public enum GiftErrorCode {

    /** Unknown or inactive gift definition, or a non-positive quantity. */
    INVALID_ITEM(HttpStatus.BAD_REQUEST, "Invalid Item"),

    /** A debit exceeds the units held. */
    INSUFFICIENT_BALANCE(HttpStatus.BAD_REQUEST, "Insufficient Balance"),

    /** Unknown transaction or redemption code. */
    NOT_FOUND(HttpStatus.NOT_FOUND, "Gift Not Found"),

    /** The gift was already redeemed. Terminal. */
    ALREADY_REDEEMED(HttpStatus.CONFLICT, "Already Redeemed"),

    /** Persistence unavailable. Not retried by the service. */
    STORAGE_FAILURE(HttpStatus.SERVICE_UNAVAILABLE, "Storage Unavailable");

    private final HttpStatus status;
    private final String title;

    GiftErrorCode(HttpStatus status, String title) {
        this.status = status;
        this.title = title;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getTitle() {
        return title;
    }
}
