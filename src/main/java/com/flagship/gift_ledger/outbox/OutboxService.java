package com.flagship.gift_ledger.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.gift_ledger.event.GiftLifecycleEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Writes lifecycle events to the outbox and tracks their publication.
 *
 * {@link #record} only runs inside the caller's business transaction: the
 * event commits or rolls back together with the purchase, send or redemption
 * it describes. Kafka delivery happens later in {@link OutboxPublisher}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    /**
     * @throws org.springframework.transaction.IllegalTransactionStateException
     *         if no transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent record(GiftLifecycleEvent event) {
        OutboxEvent pending = OutboxEvent.pending(
            event.getAggregateType(),
            event.getAggregateId(),
            event.getEventType(),
            serializePayload(event)
        );
        OutboxEventEntity saved = repository.save(OutboxEventEntity.fromDomain(pending));

        log.debug("Recorded outbox event: type={}, aggregateType={}, aggregateId={}",
            event.getEventType(), event.getAggregateType(), event.getAggregateId());

        return saved.toDomain();
    }

    /**
     * Leases the next publishable events to the caller. The row locks only
     * last until this method commits; the lease is what keeps other
     * publishers away while the caller sends. {@link #markPublished} and
     * {@link #markFailed} release it, and an abandoned lease expires.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> claimBatch(int limit, int maxRetries, Duration lease) {
        Instant now = Instant.now();
        Instant leaseEnd = now.plus(lease);
        List<OutboxEventEntity> claimed = repository.findClaimableForUpdate(limit, maxRetries, now);
        claimed.forEach(entity -> entity.claimUntil(leaseEnd));
        if (!claimed.isEmpty()) {
            log.debug("Claimed {} outbox events until {}", claimed.size(), leaseEnd);
        }
        return claimed.stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
            log.debug("Marked event {} as published", eventId);
        });
    }

    /**
     * Increments the retry count and keeps the last error.
     *
     * @return the updated event, or null if it no longer exists
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public OutboxEvent markFailed(UUID eventId, String errorMessage) {
        return repository.findById(eventId).map(entity -> {
            entity.markFailed(errorMessage);
            OutboxEventEntity saved = repository.save(entity);
            log.warn("Publishing event {} failed (attempt #{}): {}",
                eventId, saved.getRetryCount(), errorMessage);
            return saved.toDomain();
        }).orElse(null);
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> eventsFor(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
            .stream()
            .map(OutboxEventEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String serializePayload(GiftLifecycleEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Failed to serialize " + event.getEventType() + " payload", e);
        }
    }
}
