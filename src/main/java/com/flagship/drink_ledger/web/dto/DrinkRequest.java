package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for booking a drink.
 *
 * With a user_key the purchase is booked on that prepaid user and needs no
 * login. Otherwise the logged in user is charged, on their prepaid record if
 * prepaid is true.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DrinkRequest {

    @JsonProperty("user_key")
    private String userKey;

    @JsonProperty("prepaid")
    private boolean prepaid;

    @JsonProperty("drink_type_id")
    private Integer drinkTypeId;
}
