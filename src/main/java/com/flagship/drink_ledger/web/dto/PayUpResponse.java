package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.transaction.Money;
import com.flagship.drink_ledger.transaction.PayUpResult;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

@Value
@Builder
public class PayUpResponse {

    @JsonProperty("payer")
    PostpaidUserResponse payer;

    @JsonProperty("receiver")
    PostpaidUserResponse receiver;

    @JsonProperty("amount")
    BigDecimal amount;

    public static PayUpResponse from(PayUpResult result) {
        return PayUpResponse.builder()
            .payer(PostpaidUserResponse.from(result.getPayer()))
            .receiver(PostpaidUserResponse.from(result.getReceiver()))
            .amount(Money.fromCents(result.getAmountCents()))
            .build();
    }
}
