package com.flagship.gift_ledger.inventory;

import com.flagship.gift_ledger.catalog.GiftCategory;
import com.flagship.gift_ledger.exception.InsufficientBalanceException;
import com.flagship.gift_ledger.exception.InvalidItemException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Per-account unit counts of each gift definition.
 *
 * Counts are changed only through {@link #credit} and {@link #debit}, both of
 * which are single SQL statements so that concurrent callers never observe or
 * produce a negative balance. The {@code unit_count >= 0} check constraint
 * backs this up at the database level.
 *
 * Both mutations join the caller's transaction: a purchase or send that fails
 * after crediting or debiting rolls the change back.
 */
@Service
@Slf4j
public class InventoryLedgerService {

    private final JdbcTemplate jdbcTemplate;

    public InventoryLedgerService(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Adds {@code quantity} units, creating the entry on first credit.
     *
     * @throws InvalidItemException if the new count would not fit the
     *         {@code INTEGER} column; nothing is changed
     */
    @Transactional
    public void credit(UUID accountId, Long giftDefinitionId, int quantity) {
        requirePositive(quantity);
        int rows = jdbcTemplate.update(
            "INSERT INTO inventory_entries (account_id, gift_definition_id, unit_count, created_at, updated_at) " +
            "VALUES (?, ?, ?, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP) " +
            "ON CONFLICT (account_id, gift_definition_id) " +
            "DO UPDATE SET unit_count = inventory_entries.unit_count + EXCLUDED.unit_count, " +
            "updated_at = CURRENT_TIMESTAMP " +
            "WHERE inventory_entries.unit_count <= ?",
            accountId,
            giftDefinitionId,
            quantity,
            Integer.MAX_VALUE - quantity
        );
        if (rows == 0) {
            throw InvalidItemException.holdingTooLarge(giftDefinitionId, quantity);
        }
        log.debug("Credited {} x gift {} to account {}", quantity, giftDefinitionId, accountId);
    }

    /**
     * Removes {@code quantity} units if at least that many are held.
     *
     * The balance check and the decrement are one conditional UPDATE. Of two
     * concurrent debits racing for the last unit, the second blocks on the row
     * lock, re-evaluates the predicate against the committed count and matches
     * nothing.
     *
     * @throws InsufficientBalanceException if fewer than {@code quantity} units
     *         are held, including when no entry exists; nothing is changed
     */
    @Transactional
    public void debit(UUID accountId, Long giftDefinitionId, int quantity) {
        requirePositive(quantity);
        int updated = jdbcTemplate.update(
            "UPDATE inventory_entries SET unit_count = unit_count - ?, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ? AND gift_definition_id = ? AND unit_count >= ?",
            quantity,
            accountId,
            giftDefinitionId,
            quantity
        );
        if (updated == 0) {
            throw new InsufficientBalanceException(accountId, giftDefinitionId, quantity);
        }
        log.debug("Debited {} x gift {} from account {}", quantity, giftDefinitionId, accountId);
    }

    /**
     * Units of one definition held by the account; 0 when no entry exists.
     */
    @Transactional(readOnly = true)
    public int balanceOf(UUID accountId, Long giftDefinitionId) {
        List<Integer> counts = jdbcTemplate.queryForList(
            "SELECT unit_count FROM inventory_entries WHERE account_id = ? AND gift_definition_id = ?",
            Integer.class,
            accountId,
            giftDefinitionId
        );
        return counts.isEmpty() ? 0 : counts.get(0);
    }

    /**
     * Strictly positive balances of the account, ordered by category then name.
     * Entries drained to zero stay in storage but are not listed.
     */
    @Transactional(readOnly = true)
    public List<InventoryBalance> query(UUID accountId) {
        return jdbcTemplate.query(
            "SELECT d.id, d.name, d.emoji, d.description, d.unit_price, d.category, i.unit_count " +
            "FROM inventory_entries i " +
            "JOIN gift_definitions d ON d.id = i.gift_definition_id " +
            "WHERE i.account_id = ? AND i.unit_count > 0 " +
            "ORDER BY d.category, d.name",
            balanceRowMapper(),
            accountId
        );
    }

    private void requirePositive(int quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Quantity must be positive: " + quantity);
        }
    }

    private RowMapper<InventoryBalance> balanceRowMapper() {
        return (rs, rowNum) -> new InventoryBalance(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("emoji"),
            rs.getString("description"),
            rs.getBigDecimal("unit_price"),
            GiftCategory.valueOf(rs.getString("category")),
            rs.getInt("unit_count")
        );
    }
}
