package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Landing page data. Anonymous visitors only get the login URL.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HomeResponse {

    @JsonProperty("authenticated")
    boolean authenticated;

    @JsonProperty("login_url")
    String loginUrl;

    @JsonProperty("account")
    PostpaidUserResponse account;

    @JsonProperty("prepaid_users")
    List<PrepaidUserResponse> prepaidUsers;

    @JsonProperty("drink_types")
    List<DrinkTypeResponse> drinkTypes;
}
