package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Username plus an amount in currency units, shared by top-up, payup and the
 * set-money overrides. Negative amounts are allowed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UserMoneyRequest {

    @NotBlank(message = "Username is required")
    @JsonProperty("username")
    private String username;

    @NotNull(message = "Money is required")
    @JsonProperty("money")
    private BigDecimal money;
}
