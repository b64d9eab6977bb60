package com.flagship.gift_ledger.transfer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Storage access for gift transactions: JPA for the aggregate itself,
 * JdbcTemplate for reporting joins.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GiftTransactionPersistenceService {

    /**
     * Prefix of the scanned QR payload, accepted wherever a code is.
     */
    public static final String QR_PAYLOAD_PREFIX = "CADEAUTJE:";

    private final GiftTransactionRepository repository;
    private final JdbcTemplate jdbcTemplate;

    @Transactional
    public GiftTransaction save(GiftTransaction transaction) {
        GiftTransaction saved = repository.save(GiftTransactionEntity.fromDomain(transaction)).toDomain();
        log.debug("Saved gift transaction {} with status {}", saved.getId(), saved.getStatus());
        return saved;
    }

    /**
     * Looks a gift up by redemption code, QR payload or transaction id, in
     * that order. Blank or malformed input resolves to nothing.
     */
    @Transactional(readOnly = true)
    public Optional<GiftTransaction> resolve(String codeOrTransactionId) {
        if (codeOrTransactionId == null || codeOrTransactionId.isBlank()) {
            return Optional.empty();
        }
        String candidate = codeOrTransactionId.trim();
        if (candidate.startsWith(QR_PAYLOAD_PREFIX)) {
            candidate = candidate.substring(QR_PAYLOAD_PREFIX.length());
        }

        Optional<GiftTransactionEntity> byCode = repository.findByRedemptionCode(candidate);
        if (byCode.isPresent()) {
            return byCode.map(GiftTransactionEntity::toDomain);
        }
        return parseId(candidate)
            .flatMap(repository::findById)
            .map(GiftTransactionEntity::toDomain);
    }

    /**
     * Applies a REDEEMED transition computed by {@link GiftTransaction#redeem}.
     *
     * @return false if another caller redeemed the gift first
     */
    @Transactional
    public boolean markRedeemed(GiftTransaction redeemed) {
        int updated = repository.markRedeemed(
            redeemed.getId(),
            redeemed.getRedeemedAt(),
            redeemed.getRedeemingPartyId(),
            GiftTransactionStatus.REDEEMED,
            GiftTransactionStatus.ISSUED
        );
        return updated == 1;
    }

    /**
     * Sent gifts of an account, newest first.
     *
     * @param limit maximum rows, or 0 for all
     */
    @Transactional(readOnly = true)
    public List<SentGift> findSentBy(UUID senderAccountId, int limit) {
        String sql = "SELECT t.id, t.receiver_email, t.message, t.status, t.created_at, t.redeemed_at, " +
            "d.id AS gift_definition_id, d.name, d.emoji, d.description, d.unit_price " +
            "FROM gift_transactions t " +
            "JOIN gift_definitions d ON d.id = t.gift_definition_id " +
            "WHERE t.sender_account_id = ? " +
            "ORDER BY t.created_at DESC, t.id";
        if (limit > 0) {
            return jdbcTemplate.query(sql + " LIMIT ?", sentGiftRowMapper(), senderAccountId, limit);
        }
        return jdbcTemplate.query(sql, sentGiftRowMapper(), senderAccountId);
    }

    @Transactional(readOnly = true)
    public PartnerRedemptionStats statsForParty(UUID partyId) {
        return jdbcTemplate.queryForObject(
            "SELECT COUNT(*) AS redemption_count, COALESCE(SUM(d.unit_price), 0) AS total_value, " +
            "MAX(t.redeemed_at) AS last_redeemed_at " +
            "FROM gift_transactions t " +
            "JOIN gift_definitions d ON d.id = t.gift_definition_id " +
            "WHERE t.redeeming_party_id = ? AND t.status = 'REDEEMED'",
            (rs, rowNum) -> new PartnerRedemptionStats(
                partyId,
                rs.getLong("redemption_count"),
                rs.getBigDecimal("total_value"),
                toInstant(rs.getTimestamp("last_redeemed_at"))
            ),
            partyId
        );
    }

    private Optional<UUID> parseId(String candidate) {
        try {
            return Optional.of(UUID.fromString(candidate));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    private RowMapper<SentGift> sentGiftRowMapper() {
        return (rs, rowNum) -> new SentGift(
            UUID.fromString(rs.getString("id")),
            rs.getString("receiver_email"),
            rs.getString("message"),
            GiftTransactionStatus.valueOf(rs.getString("status")),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("redeemed_at")),
            rs.getLong("gift_definition_id"),
            rs.getString("name"),
            rs.getString("emoji"),
            rs.getString("description"),
            rs.getBigDecimal("unit_price")
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
