package com.flagship.gift_ledger.exception;

import java.math.BigDecimal;

/**
 * Thrown when a purchase or send references a gift definition that does not
 * exist or is no longer active, or asks for a quantity that cannot be held.
 */
public class InvalidItemException extends GiftLifecycleException {

    private final Long giftDefinitionId;

    public InvalidItemException(Long giftDefinitionId, String message) {
        super(GiftErrorCode.INVALID_ITEM, message);
        this.giftDefinitionId = giftDefinitionId;
    }

    public static InvalidItemException unknownGift(Long giftDefinitionId) {
        return new InvalidItemException(giftDefinitionId, "Invalid gift type: " + giftDefinitionId);
    }

    public static InvalidItemException nonPositiveQuantity(Long giftDefinitionId, Integer quantity) {
        return new InvalidItemException(giftDefinitionId,
                String.format("Quantity must be a positive integer for gift type %s, got %s",
                        giftDefinitionId, quantity));
    }

    public static InvalidItemException totalTooLarge(BigDecimal total, BigDecimal maximum) {
        return new InvalidItemException(null,
                String.format("Purchase total %s exceeds the maximum of %s", total, maximum));
    }

    public static InvalidItemException holdingTooLarge(Long giftDefinitionId, int quantity) {
        return new InvalidItemException(giftDefinitionId,
                String.format("Adding %d units of gift type %s exceeds the maximum holding of %d",
                        quantity, giftDefinitionId, Integer.MAX_VALUE));
    }

    public Long getGiftDefinitionId() {
        return giftDefinitionId;
    }
}
