package com.flagship.drink_ledger.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyTest {

    @Test
    @DisplayName("Decimal amounts are converted to cents rounding half up")
    void toCentsRoundsHalfUp() {
        assertEquals(150, Money.toCents(new BigDecimal("1.50")));
        assertEquals(151, Money.toCents(new BigDecimal("1.505")));
        assertEquals(150, Money.toCents(new BigDecimal("1.504")));
        assertEquals(-151, Money.toCents(new BigDecimal("-1.505")));
        assertEquals(1000, Money.toCents(BigDecimal.TEN));
    }

    @Test
    @DisplayName("Missing or oversized amounts are rejected")
    void invalidAmounts() {
        assertThrows(IllegalArgumentException.class, () -> Money.toCents(null));
        assertThrows(IllegalArgumentException.class, () -> Money.toCents(new BigDecimal("1e30")));
    }

    @Test
    @DisplayName("Cents are rendered with two decimals")
    void fromCents() {
        assertEquals(new BigDecimal("3.50"), Money.fromCents(350));
        assertEquals(new BigDecimal("-1.50"), Money.fromCents(-150));
    }
}
