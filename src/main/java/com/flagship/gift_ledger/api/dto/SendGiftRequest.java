package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

@Value
public class SendGiftRequest {

    @NotNull(message = "Gift type ID is required")
    @JsonProperty("giftTypeId")
    Long giftTypeId;

    @Email(message = "Receiver email must be a valid address")
    @Size(max = 320, message = "Receiver email is too long")
    @JsonProperty("receiverEmail")
    String receiverEmail;

    @Size(max = 1000, message = "Message cannot exceed 1000 characters")
    @JsonProperty("message")
    String message;
}
