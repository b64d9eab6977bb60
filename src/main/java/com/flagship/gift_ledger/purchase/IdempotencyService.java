package com.flagship.gift_ledger.purchase;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps purchase idempotency keys to receipt ids.
 *
 * Redis is a cache in front of the {@code purchase_receipts.idempotency_key}
 * unique column. A Redis outage only costs a database lookup; a database
 * failure propagates.
 */
@Service
@Slf4j
public class IdempotencyService {

    static final String REDIS_KEY_PREFIX = "idempotency:purchase:";
    static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PurchaseReceiptRepository receiptRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(PurchaseReceiptRepository receiptRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.receiptRepository = receiptRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the receipt id already recorded for this key, if any
     */
    @Transactional(readOnly = true)
    public Optional<UUID> findReceiptId(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<UUID> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<UUID> stored = receiptRepository.findByIdempotencyKey(idempotencyKey)
            .map(PurchaseReceiptEntity::getId);
        stored.ifPresent(receiptId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeCache(idempotencyKey, receiptId);
        });
        return stored;
    }

    /**
     * Caches a key after its receipt was written. The receipt row itself is
     * the durable record.
     */
    public void remember(String idempotencyKey, UUID receiptId) {
        requireKey(idempotencyKey);
        if (receiptId == null) {
            throw new IllegalArgumentException("Receipt ID cannot be null");
        }
        writeCache(idempotencyKey, receiptId);
    }

    private Optional<UUID> readCache(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            String value = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
            return Optional.ofNullable(value).map(UUID::fromString);
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, UUID receiptId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, receiptId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
