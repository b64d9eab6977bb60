package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.catalog.GiftCategory;
import com.flagship.gift_ledger.inventory.InventoryBalance;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class InventoryItemResponse {

    @JsonProperty("giftTypeId")
    Long giftTypeId;

    @JsonProperty("name")
    String name;

    @JsonProperty("emoji")
    String emoji;

    @JsonProperty("description")
    String description;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("category")
    GiftCategory category;

    @JsonProperty("quantity")
    int quantity;

    public static InventoryItemResponse from(InventoryBalance balance) {
        return InventoryItemResponse.builder()
            .giftTypeId(balance.getGiftDefinitionId())
            .name(balance.getName())
            .emoji(balance.getEmoji())
            .description(balance.getDescription())
            .price(balance.getUnitPrice())
            .category(balance.getCategory())
            .quantity(balance.getQuantity())
            .build();
    }
}
