package com.flagship.gift_ledger.sync;

import com.flagship.gift_ledger.account.AccountService;
import com.flagship.gift_ledger.inventory.InventoryLedgerService;
import com.flagship.gift_ledger.observability.CorrelationContext;
import com.flagship.gift_ledger.transfer.GiftTransferService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;

/**
 * Brings a mobile device up to date: records the device against the account
 * and returns the current inventory with the most recent sent gifts.
 */
@Service
@Slf4j
public class DeviceSyncService {

    private final AccountService accountService;
    private final InventoryLedgerService inventoryLedger;
    private final GiftTransferService transferService;
    private final int recentLimit;

    public DeviceSyncService(AccountService accountService,
                             InventoryLedgerService inventoryLedger,
                             GiftTransferService transferService,
                             @Value("${gifting.sync.recent-limit:10}") int recentLimit) {
        this.accountService = accountService;
        this.inventoryLedger = inventoryLedger;
        this.transferService = transferService;
        this.recentLimit = recentLimit;
    }

    /**
     * @param deviceId device identifier, or null to leave the stored one unchanged
     * @throws IllegalArgumentException if the account does not exist
     */
    @Transactional
    public SyncSnapshot sync(UUID accountId, String deviceId) {
        CorrelationContext.putAccountId(accountId);
        try {
            if (deviceId != null && !deviceId.isBlank()) {
                accountService.updateDeviceId(accountId, deviceId.trim());
            }
            SyncSnapshot snapshot = new SyncSnapshot(
                inventoryLedger.query(accountId),
                transferService.sentHistory(accountId, recentLimit),
                Instant.now()
            );
            log.info("Synced device {}: {} inventory line(s), {} recent gift(s)",
                deviceId, snapshot.getInventory().size(), snapshot.getRecentSent().size());
            return snapshot;
        } finally {
            CorrelationContext.clearLifecycleKeys();
        }
    }
}
