package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class GiftTypesResponse {

    @JsonProperty("giftTypes")
    List<GiftTypeResponse> giftTypes;
}
