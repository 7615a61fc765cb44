package com.flagship.drink_ledger.transaction;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between decimal currency at the API boundary and the integer
 * cents used inside the ledger.
 */
public final class Money {

    private static final BigDecimal CENTS_PER_UNIT = BigDecimal.valueOf(100);

    private Money() {
        // Utility class
    }

    /**
     * Multiplies by 100 and rounds half-up, e.g. {@code 1.505 -> 151}.
     *
     * @throws IllegalArgumentException if the amount is null or does not fit into a long
     */
    public static long toCents(BigDecimal amount) {
        if (amount == null) {
            throw new IllegalArgumentException("Amount is required");
        }
        try {
            return amount.multiply(CENTS_PER_UNIT)
                .setScale(0, RoundingMode.HALF_UP)
                .longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("Amount out of range: " + amount);
        }
    }

    public static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents, 2);
    }
}
