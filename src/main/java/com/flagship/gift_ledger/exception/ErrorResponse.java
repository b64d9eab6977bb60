package com.flagship.gift_ledger.exception;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Error body returned by every failing API call.
 */
@Value
@Builder
public class ErrorResponse {
    String error;
    String message;
    Map<String, String> details;
    Instant timestamp;

    public static ErrorResponse of(String error, String message) {
        return ErrorResponse.builder()
            .error(error)
            .message(message)
            .timestamp(Instant.now())
            .build();
    }
}
