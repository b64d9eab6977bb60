package com.flagship.gift_ledger.purchase;

import lombok.Value;

import java.math.BigDecimal;

/**
 * A priced purchase line. The unit price is captured at purchase time so
 * later catalog changes never alter a receipt.
 */
@Value
public class PurchaseLineItem {
    Long giftDefinitionId;
    int quantity;
    BigDecimal unitPrice;

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }
}
