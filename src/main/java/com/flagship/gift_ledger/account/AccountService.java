package com.flagship.gift_ledger.account;

import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Account lookups and registration used by the lifecycle engine.
 */
@Service
@Slf4j
public class AccountService {

    private final JdbcTemplate jdbcTemplate;

    public AccountService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Registers an account. Emails are stored lower-cased and must be unique.
     *
     * @param credentialHash hash produced by the authentication layer
     * @return the new account id
     */
    @Transactional
    public UUID createAccount(String email, String displayName, String credentialHash) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("Email is required");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("Display name is required");
        }
        if (credentialHash == null || credentialHash.isBlank()) {
            throw new IllegalArgumentException("Credential hash is required");
        }

        UUID accountId = UUID.randomUUID();
        jdbcTemplate.update(
            "INSERT INTO accounts (id, email, display_name, credential_hash, created_at) " +
            "VALUES (?, ?, ?, ?, CURRENT_TIMESTAMP)",
            accountId,
            email.trim().toLowerCase(Locale.ROOT),
            displayName.trim(),
            credentialHash
        );
        log.info("Registered account {}", accountId);
        return accountId;
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(UUID accountId) {
        List<Account> rows = jdbcTemplate.query(
            "SELECT id, email, display_name, credential_hash, device_id, created_at FROM accounts WHERE id = ?",
            accountRowMapper(),
            accountId
        );
        return rows.stream().findFirst();
    }

    @Transactional(readOnly = true)
    public Optional<String> findDisplayName(UUID accountId) {
        List<String> names = jdbcTemplate.queryForList(
            "SELECT display_name FROM accounts WHERE id = ?",
            String.class,
            accountId
        );
        return names.stream().findFirst();
    }

    /**
     * Records the device that last synced this account's inventory.
     *
     * @throws IllegalArgumentException if the account does not exist
     */
    @Transactional
    public void updateDeviceId(UUID accountId, String deviceId) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET device_id = ? WHERE id = ?",
            deviceId,
            accountId
        );
        if (updated == 0) {
            throw new IllegalArgumentException("Account not found: " + accountId);
        }
        log.debug("Updated device for account {}", accountId);
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> new Account(
            UUID.fromString(rs.getString("id")),
            rs.getString("email"),
            rs.getString("display_name"),
            rs.getString("credential_hash"),
            rs.getString("device_id"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
