package com.flagship.gift_ledger.catalog;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Optional;

/**
 * Read-mostly access to the gift catalog.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CatalogService {

    private final GiftDefinitionRepository repository;

    /**
     * Active gift definitions ordered by category, then name.
     */
    @Transactional(readOnly = true)
    public List<GiftDefinition> listGiftTypes() {
        return repository.findByActiveTrueOrderByCategoryAscNameAsc()
            .stream()
            .map(GiftDefinitionEntity::toDomain)
            .toList();
    }

    /**
     * Resolves a definition only if it is currently purchasable.
     */
    @Transactional(readOnly = true)
    public Optional<GiftDefinition> findActive(Long giftDefinitionId) {
        if (giftDefinitionId == null) {
            return Optional.empty();
        }
        return repository.findByIdAndActiveTrue(giftDefinitionId)
            .map(GiftDefinitionEntity::toDomain);
    }

    /**
     * Resolves a definition regardless of its active flag. Held units of a
     * retired gift stay sendable and redeemable.
     */
    @Transactional(readOnly = true)
    public Optional<GiftDefinition> findById(Long giftDefinitionId) {
        if (giftDefinitionId == null) {
            return Optional.empty();
        }
        return repository.findById(giftDefinitionId)
            .map(GiftDefinitionEntity::toDomain);
    }

    @Transactional
    public GiftDefinition createGiftDefinition(String name, String emoji, String description,
                                               GiftCategory category, BigDecimal unitPrice) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Gift name is required");
        }
        if (emoji == null || emoji.isBlank()) {
            throw new IllegalArgumentException("Gift emoji is required");
        }
        if (category == null) {
            throw new IllegalArgumentException("Gift category is required");
        }
        if (unitPrice == null || unitPrice.compareTo(BigDecimal.ZERO) <= 0) {
            throw new IllegalArgumentException("Unit price must be positive");
        }

        GiftDefinitionEntity saved = repository.save(GiftDefinitionEntity.create(
            name, emoji, description, category, unitPrice.setScale(2, RoundingMode.HALF_UP)));
        log.info("Added gift definition {} ({}) at {}", saved.getId(), name, saved.getUnitPrice());
        return saved.toDomain();
    }

    /**
     * Toggles whether a definition can be purchased.
     *
     * @throws IllegalArgumentException if the definition does not exist
     */
    @Transactional
    public GiftDefinition setActive(Long giftDefinitionId, boolean active) {
        GiftDefinitionEntity entity = repository.findById(giftDefinitionId)
            .orElseThrow(() -> new IllegalArgumentException("Gift definition not found: " + giftDefinitionId));
        entity.changeActive(active);
        log.info("Gift definition {} active={}", giftDefinitionId, active);
        return repository.save(entity).toDomain();
    }
}
