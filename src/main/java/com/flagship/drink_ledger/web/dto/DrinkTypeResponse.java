package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.ledger.DrinkType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DrinkTypeResponse {

    @JsonProperty("id")
    Integer id;

    @JsonProperty("name")
    String name;

    @JsonProperty("icon")
    String icon;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("consumed")
    long consumed;

    public static DrinkTypeResponse from(DrinkType drinkType) {
        return DrinkTypeResponse.builder()
            .id(drinkType.getId())
            .name(drinkType.getName())
            .icon(drinkType.getIcon())
            .quantity(drinkType.getQuantity())
            .consumed(drinkType.getConsumed())
            .build();
    }
}
