package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.transaction.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PostpaidUserResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("username")
    String username;

    @JsonProperty("money")
    BigDecimal money;

    @JsonProperty("activated")
    boolean activated;

    @JsonProperty("last_drink")
    Instant lastDrink;

    public static PostpaidUserResponse from(PostpaidUser user) {
        return PostpaidUserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .money(Money.fromCents(user.getMoney()))
            .activated(user.isActivated())
            .lastDrink(user.getLastDrink())
            .build();
    }
}
