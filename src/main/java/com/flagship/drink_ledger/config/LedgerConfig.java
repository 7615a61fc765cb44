package com.flagship.drink_ledger.config;

import com.flagship.drink_ledger.authz.AuthorizationPolicy;
import com.flagship.drink_ledger.observability.LedgerMetrics;
import com.flagship.drink_ledger.store.InMemoryLedgerStore;
import com.flagship.drink_ledger.store.JdbcLedgerStore;
import com.flagship.drink_ledger.store.LedgerStore;
import com.flagship.drink_ledger.transaction.KeyedLocks;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import com.flagship.drink_ledger.transaction.UserKeyGenerator;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.util.List;

/**
 * Wires the ledger core: one explicitly constructed store instance is
 * injected into the transaction service.
 *
 * Store selection via {@code ledger.store.type}:
 * - jdbc (default): PostgreSQL through JdbcTemplate
 * - memory: process-local store, state is lost on restart
 */
@Configuration
@Slf4j
public class LedgerConfig {

    /**
     * Catalog seeded into the in-memory store; schema.sql seeds the same rows.
     */
    static final List<String> DEFAULT_DRINK_TYPES = List.of(
        "Sonstiges",
        "Paulaner Spezi",
        "Paulaner Limo Orange",
        "Paulaner Limo Zitrone",
        "Mio Mate Original",
        "Mio Mate Ginger",
        "Mio Mate Pomegranate",
        "Club Mate"
    );

    @Bean
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "jdbc", matchIfMissing = true)
    public LedgerStore jdbcLedgerStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate) {
        log.info("Using PostgreSQL ledger store");
        return new JdbcLedgerStore(jdbcTemplate, transactionTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = "ledger.store.type", havingValue = "memory")
    public LedgerStore inMemoryLedgerStore() {
        log.warn("Using in-memory ledger store, balances are lost on restart");
        return new InMemoryLedgerStore().withDrinkTypes(DEFAULT_DRINK_TYPES);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AuthorizationPolicy authorizationPolicy(LedgerProperties properties) {
        return new AuthorizationPolicy(properties.getGroups().getMember(), properties.getGroups().getAdmin());
    }

    @Bean
    public LedgerMetrics ledgerMetrics(MeterRegistry meterRegistry) {
        return new LedgerMetrics(meterRegistry);
    }

    @Bean
    public LedgerTransactionService ledgerTransactionService(LedgerStore store,
                                                             AuthorizationPolicy authorizationPolicy,
                                                             LedgerMetrics ledgerMetrics,
                                                             Clock clock,
                                                             LedgerProperties properties) {
        return new LedgerTransactionService(
            store,
            authorizationPolicy,
            new KeyedLocks(),
            new UserKeyGenerator(properties.getUserKeyBytes()),
            ledgerMetrics,
            clock,
            properties.getPostpaid().isActivatedOnCreate()
        );
    }
}
