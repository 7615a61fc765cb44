package com.flagship.drink_ledger.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - ledger.drinks: Counter of booked drinks, tagged by user type
 * - ledger.drinks.rejected: Counter of rejected drinks, tagged by reason
 * - ledger.topups: Counter of prepaid top-ups
 * - ledger.payups: Counter of settlements between postpaid users
 * - ledger.money.moved: Counter of cents moved by top-ups and payups
 * - ledger.denials: Counter of authorization denials, tagged by operation
 * - ledger.operation.duration: Timer per engine operation
 */
public class LedgerMetrics {

    private final MeterRegistry registry;

    private final Counter topUps;
    private final Counter payUps;
    private final Counter moneyMoved;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.topUps = Counter.builder("ledger.topups")
                .description("Number of prepaid top-ups")
                .register(registry);

        this.payUps = Counter.builder("ledger.payups")
                .description("Number of settlements between postpaid users")
                .register(registry);

        this.moneyMoved = Counter.builder("ledger.money.moved")
                .description("Cents moved by top-ups and payups")
                .baseUnit("cents")
                .register(registry);
    }

    public void recordDrink(String userType) {
        registry.counter("ledger.drinks", "user_type", userType).increment();
    }

    public void recordDrinkRejected(String reason) {
        registry.counter("ledger.drinks.rejected", "reason", sanitizeTag(reason)).increment();
    }

    public void recordTopUp(long cents) {
        topUps.increment();
        moneyMoved.increment(Math.abs(cents));
    }

    public void recordPayUp(long cents) {
        payUps.increment();
        moneyMoved.increment(Math.abs(cents));
    }

    public void recordDenial(String operation) {
        registry.counter("ledger.denials", "operation", sanitizeTag(operation)).increment();
    }

    public void recordLatency(String operation, long durationMs) {
        Timer.builder("ledger.operation.duration")
                .tag("operation", operation)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Keeps tag values short and free of characters metric backends reject.
     */
    private String sanitizeTag(String value) {
        if (value == null || value.isEmpty()) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
