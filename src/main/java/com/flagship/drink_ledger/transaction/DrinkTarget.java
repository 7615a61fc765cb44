package com.flagship.drink_ledger.transaction;

import lombok.Value;

/**
 * Selects whose balance a drink purchase is booked on.
 */
@Value
public class DrinkTarget {
    Kind kind;
    String userKey;

    public static DrinkTarget selfPostpaid() {
        return new DrinkTarget(Kind.SELF_POSTPAID, null);
    }

    /**
     * The actor's own prepaid user: same username and owned by the actor's
     * postpaid account.
     */
    public static DrinkTarget selfPrepaid() {
        return new DrinkTarget(Kind.SELF_PREPAID, null);
    }

    /**
     * Point-of-sale purchase; the key is the only credential.
     */
    public static DrinkTarget byKey(String userKey) {
        if (userKey == null || userKey.isBlank()) {
            throw new IllegalArgumentException("User key is required");
        }
        return new DrinkTarget(Kind.PREPAID_BY_KEY, userKey);
    }

    public enum Kind {
        SELF_POSTPAID,
        SELF_PREPAID,
        PREPAID_BY_KEY
    }
}
