package com.flagship.drink_ledger.ledger;

import lombok.Value;
import lombok.With;

/**
 * Entry of the drink catalog.
 *
 * {@code quantity} is the stock level and {@code consumed} the aggregate
 * number of drinks booked with this type. Neither is tracked per user.
 */
@Value
@With
public class DrinkType {

    /** Catch-all type for drinks that are not in the catalog. */
    public static final int OTHER_ID = 1;

    Integer id;
    String name;
    String icon;
    int quantity;
    long consumed;

    public DrinkType consume() {
        return new DrinkType(id, name, icon, quantity - 1, consumed + 1);
    }
}
