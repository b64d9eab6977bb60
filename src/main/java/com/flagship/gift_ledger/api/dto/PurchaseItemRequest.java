package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

/**
 * Quantity is checked by the purchase processor so that every bad line
 * reports as an invalid item.
 */
@Value
public class PurchaseItemRequest {

    @NotNull(message = "Gift type ID is required")
    @JsonProperty("giftTypeId")
    Long giftTypeId;

    @JsonProperty("quantity")
    Integer quantity;
}
