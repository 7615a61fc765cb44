package com.flagship.drink_ledger.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.drink_ledger.transaction.LedgerSnapshot;
import com.flagship.drink_ledger.transaction.Money;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

/**
 * Administrative view of the whole ledger.
 */
@Value
@Builder
public class StatsResponse {

    @JsonProperty("postpaid_users")
    List<PostpaidUserResponse> postpaidUsers;

    @JsonProperty("prepaid_users")
    List<PrepaidUserResponse> prepaidUsers;

    @JsonProperty("drink_stats")
    List<DrinkTypeResponse> drinkStats;

    @JsonProperty("total_postpaid_money")
    BigDecimal totalPostpaidMoney;

    @JsonProperty("total_prepaid_money")
    BigDecimal totalPrepaidMoney;

    public static StatsResponse from(LedgerSnapshot snapshot) {
        return StatsResponse.builder()
            .postpaidUsers(snapshot.getPostpaidUsers().stream().map(PostpaidUserResponse::from).toList())
            .prepaidUsers(snapshot.getPrepaidUsers().stream().map(PrepaidUserResponse::from).toList())
            .drinkStats(snapshot.getDrinkStats().stream().map(DrinkTypeResponse::from).toList())
            .totalPostpaidMoney(Money.fromCents(snapshot.totalPostpaidMoney()))
            .totalPrepaidMoney(Money.fromCents(snapshot.totalPrepaidMoney()))
            .build();
    }
}
