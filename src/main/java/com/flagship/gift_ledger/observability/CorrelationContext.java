package com.flagship.gift_ledger.observability;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Per-thread correlation id plus the MDC keys used by lifecycle operations.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_MDC_KEY = "correlationId";
    public static final String ACCOUNT_ID_MDC_KEY = "accountId";
    public static final String GIFT_TRANSACTION_ID_MDC_KEY = "giftTransactionId";

    private static final ThreadLocal<String> correlationId = new ThreadLocal<>();

    private CorrelationContext() {
    }

    public static String getCorrelationId() {
        String id = correlationId.get();
        if (id == null) {
            id = generateCorrelationId();
            correlationId.set(id);
        }
        return id;
    }

    public static void setCorrelationId(String id) {
        correlationId.set(id != null && !id.isBlank() ? id : generateCorrelationId());
    }

    public static void clear() {
        correlationId.remove();
    }

    /**
     * Short form for readable log lines.
     */
    public static String generateCorrelationId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    public static void putAccountId(UUID accountId) {
        if (accountId != null) {
            MDC.put(ACCOUNT_ID_MDC_KEY, accountId.toString());
        }
    }

    public static void putGiftTransactionId(UUID giftTransactionId) {
        if (giftTransactionId != null) {
            MDC.put(GIFT_TRANSACTION_ID_MDC_KEY, giftTransactionId.toString());
        }
    }

    /**
     * Removes the lifecycle keys; the correlation id stays until the request ends.
     */
    public static void clearLifecycleKeys() {
        MDC.remove(ACCOUNT_ID_MDC_KEY);
        MDC.remove(GIFT_TRANSACTION_ID_MDC_KEY);
    }
}
