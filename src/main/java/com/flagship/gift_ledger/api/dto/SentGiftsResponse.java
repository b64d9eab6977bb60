package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.util.List;

@Value
public class SentGiftsResponse {

    @JsonProperty("sentGifts")
    List<SentGiftResponse> sentGifts;
}
