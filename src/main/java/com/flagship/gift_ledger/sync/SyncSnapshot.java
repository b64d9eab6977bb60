package com.flagship.gift_ledger.sync;

import com.flagship.gift_ledger.inventory.InventoryBalance;
import com.flagship.gift_ledger.transfer.SentGift;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
public class SyncSnapshot {
    List<InventoryBalance> inventory;
    List<SentGift> recentSent;
    Instant syncTime;
}
