package com.flagship.gift_ledger.inventory;

import com.flagship.gift_ledger.catalog.GiftCategory;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A strictly positive holding of one gift definition, with the
 * definition's display fields joined in.
 */
@Value
public class InventoryBalance {
    Long giftDefinitionId;
    String name;
    String emoji;
    String description;
    BigDecimal unitPrice;
    GiftCategory category;
    int quantity;
}
