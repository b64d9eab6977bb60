package com.flagship.gift_ledger.catalog;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * JPA mapping of {@code gift_definitions}.
 *
 * No setters: everything but {@code active} is {@code updatable = false}.
 */
@Entity
@Table(name = "gift_definitions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GiftDefinitionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false, length = 100)
    private String name;

    @Column(nullable = false, updatable = false, length = 16)
    private String emoji;

    @Column(updatable = false, length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 32)
    private GiftCategory category;

    @Column(name = "unit_price", nullable = false, updatable = false, precision = 10, scale = 2)
    private BigDecimal unitPrice;

    @Column(nullable = false)
    private boolean active;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
    }

    static GiftDefinitionEntity create(String name, String emoji, String description,
                                       GiftCategory category, BigDecimal unitPrice) {
        return new GiftDefinitionEntity(null, name, emoji, description, category, unitPrice, true, null);
    }

    public GiftDefinition toDomain() {
        return new GiftDefinition(id, name, emoji, description, category, unitPrice, active);
    }

    void changeActive(boolean active) {
        this.active = active;
    }
}
