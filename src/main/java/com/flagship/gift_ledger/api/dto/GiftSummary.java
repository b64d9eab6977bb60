package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.catalog.GiftDefinition;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Display fields of a gift embedded in other responses.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GiftSummary {

    @JsonProperty("name")
    String name;

    @JsonProperty("emoji")
    String emoji;

    @JsonProperty("description")
    String description;

    @JsonProperty("price")
    BigDecimal price;

    public static GiftSummary of(GiftDefinition gift) {
        return new GiftSummary(gift.getName(), gift.getEmoji(), gift.getDescription(), null);
    }

    public static GiftSummary withPrice(String name, String emoji, String description, BigDecimal price) {
        return new GiftSummary(name, emoji, description, price);
    }
}
