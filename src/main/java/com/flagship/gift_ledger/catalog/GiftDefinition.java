package com.flagship.gift_ledger.catalog;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A purchasable gift, for example a coffee at a partner coffee shop.
 *
 * Immutable except for the active flag, which is toggled through
 * {@link CatalogService}.
 */
@Value
public class GiftDefinition {
    Long id;
    String name;
    String emoji;
    String description;
    GiftCategory category;
    BigDecimal unitPrice;
    boolean active;

    /**
     * Price of {@code quantity} units.
     */
    public BigDecimal priceOf(int quantity) {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
