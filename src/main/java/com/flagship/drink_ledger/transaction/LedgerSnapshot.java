package com.flagship.drink_ledger.transaction;

import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import lombok.Value;

import java.util.List;

/**
 * Consistent view of the whole ledger for administrators.
 * Drink types are ordered by consumption, most consumed first.
 */
@Value
public class LedgerSnapshot {
    List<PostpaidUser> postpaidUsers;
    List<PrepaidUser> prepaidUsers;
    List<DrinkType> drinkStats;

    public long totalPostpaidMoney() {
        return postpaidUsers.stream().mapToLong(PostpaidUser::getMoney).sum();
    }

    public long totalPrepaidMoney() {
        return prepaidUsers.stream().mapToLong(PrepaidUser::getMoney).sum();
    }
}
