package com.flagship.drink_ledger.ledger;

import lombok.Value;
import lombok.With;

import java.time.Instant;

/**
 * Domain model for a postpaid member.
 *
 * Postpaid users are billed after consumption: {@code money} is a running
 * balance in cents and may go negative, which represents debt that is
 * settled later through a payup.
 *
 * Key invariant: {@code id} and {@code username} never change once the
 * store has assigned them.
 */
@Value
@With
public class PostpaidUser {
    Long id;
    String username;
    long money;
    boolean activated;
    Instant lastDrink;

    /**
     * Creates a not yet persisted user. The store assigns the id on insert.
     */
    public static PostpaidUser create(String username, boolean activated) {
        if (username == null || username.isBlank()) {
            throw new IllegalArgumentException("Username is required");
        }
        return new PostpaidUser(null, username, 0L, activated, null);
    }

    /**
     * Books a drink: the price is subtracted without any floor.
     */
    public PostpaidUser drink(long priceCents, Instant at) {
        return new PostpaidUser(id, username, money - priceCents, activated, at);
    }

    public PostpaidUser addMoney(long deltaCents) {
        return withMoney(money + deltaCents);
    }

    public PostpaidUser toggleActivated() {
        return withActivated(!activated);
    }
}
