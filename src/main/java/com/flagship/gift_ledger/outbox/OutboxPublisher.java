package com.flagship.gift_ledger.outbox;

import com.flagship.gift_ledger.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Polls the outbox and publishes gift events to Kafka, keyed by aggregate id
 * so that all events of one gift land on the same partition in order.
 *
 * A failed send increments the event's retry count. Once it reaches
 * {@code outbox.publisher.max-retries} the event is dead-lettered: it stays in
 * the table unpublished and is no longer picked up.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.gifts:gift-events}")
    private String giftsTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.claim-lease-ms:300000}")
    private long claimLeaseMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.claimBatch(batchSize, maxRetries, Duration.ofMillis(claimLeaseMs));
            if (events.isEmpty()) {
                return;
            }
            log.debug("Publishing {} outbox events", events.size());
            for (OutboxEvent event : events) {
                publish(event);
            }
        } catch (Exception e) {
            log.error("Outbox polling failed", e);
        }
    }

    private void publish(OutboxEvent event) {
        String key = event.getAggregateId().toString();
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(giftsTopic, key, event.getPayload())
                .get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);

            log.debug("Published event {} ({}) to {}-{}@{}",
                event.getId(),
                event.getEventType(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, e);
        } catch (Exception e) {
            recordFailure(event, e);
        }
    }

    private void recordFailure(OutboxEvent event, Exception cause) {
        log.error("Failed to publish event {} ({}): {}", event.getId(), event.getEventType(), cause.getMessage());
        outboxMetrics.recordEventPublishFailed(event.getEventType());

        OutboxEvent updated = outboxService.markFailed(event.getId(), cause.getMessage());
        if (updated != null && updated.isDeadLettered(maxRetries)) {
            log.warn("Event {} dead-lettered after {} attempts. eventType={}, aggregateId={}",
                updated.getId(), updated.getRetryCount(), updated.getEventType(), updated.getAggregateId());
            outboxMetrics.recordEventDeadLettered(updated.getEventType());
        }
    }
}
