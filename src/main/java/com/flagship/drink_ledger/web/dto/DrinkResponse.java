package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.ledger.UserKind;
import com.flagship.drink_ledger.transaction.DrinkReceipt;
import com.flagship.drink_ledger.transaction.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class DrinkResponse {

    @JsonProperty("user_type")
    UserKind userType;

    @JsonProperty("username")
    String username;

    @JsonProperty("price")
    BigDecimal price;

    @JsonProperty("money")
    BigDecimal money;

    @JsonProperty("last_drink")
    Instant lastDrink;

    @JsonProperty("drink_type_id")
    Integer drinkTypeId;

    public static DrinkResponse from(DrinkReceipt receipt) {
        return DrinkResponse.builder()
            .userType(receipt.getUserKind())
            .username(receipt.getUsername())
            .price(Money.fromCents(receipt.getPriceCents()))
            .money(Money.fromCents(receipt.getMoneyAfter()))
            .lastDrink(receipt.getDrankAt())
            .drinkTypeId(receipt.getDrinkTypeId())
            .build();
    }
}
