package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.ledger.UserKind;
import lombok.Value;

@Value
public class ActivationResponse {

    @JsonProperty("username")
    String username;

    @JsonProperty("user_type")
    UserKind userType;

    @JsonProperty("activated")
    boolean activated;
}
