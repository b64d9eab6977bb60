package com.flagship.gift_ledger.catalog;

/**
 * Catalog grouping. Stored by name; listings sort on the stored name.
 */
public enum GiftCategory {
    DRINKS,
    FOOD,
    ENTERTAINMENT,
    LIFESTYLE
}
