package com.flagship.drink_ledger.transaction;

import com.flagship.drink_ledger.ledger.UserKind;
import lombok.Value;

import java.time.Instant;

/**
 * Outcome of a booked drink: the charged account and its balance afterwards.
 */
@Value
public class DrinkReceipt {
    UserKind userKind;
    String username;
    long priceCents;
    long moneyAfter;
    Instant drankAt;
    Integer drinkTypeId;
}
