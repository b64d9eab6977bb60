package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Value;

import java.util.List;

@Value
public class PurchaseRequest {

    @NotEmpty(message = "At least one item is required")
    @Valid
    @JsonProperty("items")
    List<PurchaseItemRequest> items;
}
