package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.transaction.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Prepaid user as shown to its owner or an administrator. The user key is
 * included so the owner can hand it out.
 */
@Value
@Builder
public class PrepaidUserResponse {

    @JsonProperty("id")
    Long id;

    @JsonProperty("username")
    String username;

    @JsonProperty("user_key")
    String userKey;

    @JsonProperty("postpaid_user_id")
    long postpaidUserId;

    @JsonProperty("money")
    BigDecimal money;

    @JsonProperty("activated")
    boolean activated;

    @JsonProperty("last_drink")
    Instant lastDrink;

    public static PrepaidUserResponse from(PrepaidUser user) {
        return PrepaidUserResponse.builder()
            .id(user.getId())
            .username(user.getUsername())
            .userKey(user.getUserKey())
            .postpaidUserId(user.getPostpaidUserId())
            .money(Money.fromCents(user.getMoney()))
            .activated(user.isActivated())
            .lastDrink(user.getLastDrink())
            .build();
    }
}
