package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.util.UUID;

/**
 * {@code code} may be a redemption code, a scanned QR payload or a
 * transaction id.
 */
@Value
public class RedeemRequest {

    @NotBlank(message = "Code is required")
    @Size(max = 128, message = "Code is too long")
    @JsonProperty("code")
    String code;

    @JsonProperty("partnerId")
    UUID partnerId;
}
