package com.flagship.gift_ledger.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.gift_ledger.purchase.PurchaseLineItem;
import com.flagship.gift_ledger.purchase.PurchaseReceipt;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class PurchaseResponse {

    @JsonProperty("purchaseId")
    UUID purchaseId;

    @JsonProperty("totalAmount")
    BigDecimal totalAmount;

    @JsonProperty("items")
    List<Line> items;

    @JsonProperty("createdAt")
    Instant createdAt;

    @Value
    public static class Line {

        @JsonProperty("giftTypeId")
        Long giftTypeId;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("unitPrice")
        BigDecimal unitPrice;

        static Line from(PurchaseLineItem item) {
            return new Line(item.getGiftDefinitionId(), item.getQuantity(), item.getUnitPrice());
        }
    }

    public static PurchaseResponse from(PurchaseReceipt receipt) {
        return PurchaseResponse.builder()
            .purchaseId(receipt.getId())
            .totalAmount(receipt.getTotalAmount())
            .items(receipt.getItems().stream().map(Line::from).toList())
            .createdAt(receipt.getCreatedAt())
            .build();
    }
}
