package com.flagship.gift_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Micrometer meters for the gift lifecycle.
 *
 * <ul>
 *   <li>{@code gift.purchases} - completed purchases</li>
 *   <li>{@code gift.units.credited} - units added to inventories</li>
 *   <li>{@code gift.sent} - issued redemption codes</li>
 *   <li>{@code gift.redemptions} - redemption attempts, tagged by outcome</li>
 *   <li>{@code gift.operation.duration} - latency per lifecycle operation</li>
 * </ul>
 */
@Component
public class GiftMetrics {

    private final MeterRegistry registry;

    private final Counter purchases;
    private final Counter unitsCredited;
    private final Counter giftsSent;

    public GiftMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.purchases = Counter.builder("gift.purchases")
                .description("Number of completed purchases")
                .register(registry);

        this.unitsCredited = Counter.builder("gift.units.credited")
                .description("Gift units credited to inventories by purchases")
                .register(registry);

        this.giftsSent = Counter.builder("gift.sent")
                .description("Number of gifts sent")
                .register(registry);
    }

    public void recordPurchase(long units) {
        purchases.increment();
        unitsCredited.increment(units);
    }

    public void recordGiftSent() {
        giftsSent.increment();
    }

    /**
     * @param outcome {@code success}, or the lower-cased error code
     */
    public void recordRedemption(String outcome) {
        registry.counter("gift.redemptions", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordRejected(String operation, String errorCode) {
        registry.counter("gift.rejected",
                "operation", sanitizeTag(operation),
                "code", sanitizeTag(errorCode)
        ).increment();
    }

    public void recordLatency(String operation, Duration duration) {
        Timer.builder("gift.operation.duration")
                .tag("operation", sanitizeTag(operation))
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(duration);
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
