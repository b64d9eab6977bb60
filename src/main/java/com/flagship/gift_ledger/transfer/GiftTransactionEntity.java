package com.flagship.gift_ledger.transfer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * JPA mapping of {@code gift_transactions}.
 *
 * Redemption never goes through this entity: it is a conditional bulk update
 * in {@link GiftTransactionRepository#markRedeemed}.
 */
@Entity
@Table(name = "gift_transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class GiftTransactionEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "sender_account_id", nullable = false, updatable = false)
    private UUID senderAccountId;

    @Column(name = "receiver_email", updatable = false, length = 320)
    private String receiverEmail;

    @Column(name = "gift_definition_id", nullable = false, updatable = false)
    private Long giftDefinitionId;

    @Column(name = "redemption_code", nullable = false, updatable = false, unique = true, length = 64)
    private String redemptionCode;

    @Column(updatable = false, length = 1000)
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private GiftTransactionStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "redeemed_at")
    private Instant redeemedAt;

    @Column(name = "redeeming_party_id")
    private UUID redeemingPartyId;

    public static GiftTransactionEntity fromDomain(GiftTransaction transaction) {
        return new GiftTransactionEntity(
            transaction.getId(),
            transaction.getSenderAccountId(),
            transaction.getReceiverEmail(),
            transaction.getGiftDefinitionId(),
            transaction.getRedemptionCode(),
            transaction.getMessage(),
            transaction.getStatus(),
            transaction.getCreatedAt(),
            transaction.getRedeemedAt(),
            transaction.getRedeemingPartyId()
        );
    }

    public GiftTransaction toDomain() {
        return new GiftTransaction(id, senderAccountId, receiverEmail, giftDefinitionId,
            redemptionCode, message, status, createdAt, redeemedAt, redeemingPartyId);
    }
}
