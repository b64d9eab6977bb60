package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.catalog.GiftCategory;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class GiftTypeResponse {

    @JsonProperty("id")
    Long id;

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

    public static GiftTypeResponse from(GiftDefinition gift) {
        return GiftTypeResponse.builder()
            .id(gift.getId())
            .name(gift.getName())
            .emoji(gift.getEmoji())
            .description(gift.getDescription())
            .price(gift.getUnitPrice())
            .category(gift.getCategory())
            .build();
    }
}
