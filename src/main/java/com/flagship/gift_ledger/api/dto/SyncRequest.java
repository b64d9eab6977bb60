package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class SyncRequest {

    @Size(max = 200, message = "Device ID is too long")
    @JsonProperty("deviceId")
    String deviceId;
}
