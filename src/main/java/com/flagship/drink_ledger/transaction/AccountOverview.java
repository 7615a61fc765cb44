package com.flagship.drink_ledger.transaction;

import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import lombok.Value;

import java.util.List;

/**
 * What a member sees of their own account.
 */
@Value
public class AccountOverview {
    PostpaidUser account;
    List<PrepaidUser> prepaidUsers;
}
