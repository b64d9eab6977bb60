package com.flagship.gift_ledger.purchase;

import lombok.Value;

/**
 * One requested line of a purchase, before validation and pricing.
 */
@Value
public class PurchaseItem {
    Long giftDefinitionId;
    Integer quantity;
}
