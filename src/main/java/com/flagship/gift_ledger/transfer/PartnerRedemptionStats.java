package com.flagship.gift_ledger.transfer;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Totals over all gifts redeemed by one party, valued at current catalog prices.
 */
@Value
public class PartnerRedemptionStats {
    UUID partyId;
    long redemptionCount;
    BigDecimal totalValue;
    Instant lastRedeemedAt;
}
