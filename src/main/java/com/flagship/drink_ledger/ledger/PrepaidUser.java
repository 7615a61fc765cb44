package com.flagship.drink_ledger.ledger;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Domain model for a prepaid sub-account.
 *
 * A prepaid user is owned by exactly one postpaid user and identified at the
 * point of sale by its secret {@code userKey}. Purchases may drive the
 * balance below zero; overdraft is permitted rather than rejecting the drink.
 */
@Value
@With
public class PrepaidUser {
    Long id;
    String username;
    String userKey;
    long postpaidUserId;
    long money;
    boolean activated;
    Instant lastDrink;

    public static PrepaidUser create(String username, String userKey, long postpaidUserId, long startMoney) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("User key is required");
        }
        return new PrepaidUser(null, username, userKey, postpaidUserId, startMoney, true, null);
    }

    public PrepaidUser drink(long priceCents, Instant at) {
        return new PrepaidUser(id, username, userKey, postpaidUserId, money - priceCents, activated, at);
    }

    public PrepaidUser addMoney(long deltaCents) {
        return withMoney(money + deltaCents);
    }

    public PrepaidUser toggleActivated() {
        return withActivated(!activated);
    }

    public boolean isOwnedBy(PostpaidUser owner) {
        return owner != null && owner.getId() != null && owner.getId() == postpaidUserId;
    }
}
