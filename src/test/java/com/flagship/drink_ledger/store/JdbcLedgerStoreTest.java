package com.flagship.drink_ledger.store;

import com.flagship.drink_ledger.authz.LedgerPrincipal;
import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.ledger.exception.ConflictException;
import com.flagship.drink_ledger.ledger.exception.NotFoundException;
import com.flagship.drink_ledger.transaction.DrinkTarget;
import com.flagship.drink_ledger.transaction.LedgerTransactionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Instant;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the PostgreSQL ledger store.
 *
 * These tests verify that the database enforces what the in-memory store
 * enforces in code:
 * - Unique usernames and user keys, existing owners
 * - Retired keys stay retired
 * - Row locks prevent lost updates under concurrent drinks
 */
@SpringBootTest(properties = "ledger.postpaid.activated-on-create=true")
@Testcontainers(disabledWithoutDocker = true)
class JdbcLedgerStoreTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_drinks")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    private static final LedgerPrincipal ALICE = LedgerPrincipal.of("alice", Set.of("drinks-members"));
    private static final LedgerPrincipal ADMIN = LedgerPrincipal.of("admin", Set.of("drinks-admins"));

    @Autowired
    private LedgerStore store;

    @Autowired
    private LedgerTransactionService ledgerService;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate.execute("TRUNCATE users_prepaid, users_postpaid, retired_user_keys RESTART IDENTITY CASCADE");
        jdbcTemplate.update("DELETE FROM drink_types WHERE id > 8");
        jdbcTemplate.update("UPDATE drink_types SET quantity = 0, consumed = 0");
        jdbcTemplate.execute("SELECT setval(pg_get_serial_sequence('drink_types', 'id'), 8)");
    }

    @Test
    @DisplayName("The JDBC store is the configured default")
    void jdbcStoreIsDefault() {
        assertInstanceOf(JdbcLedgerStore.class, store);
        assertTrue(store.isAvailable());
    }

    @Test
    @DisplayName("Schema seeds the default drink catalog")
    void drinkCatalogSeeded() {
        assertEquals(8, store.listDrinkTypes().size());
        assertEquals("Sonstiges", store.findDrinkType(DrinkType.OTHER_ID).orElseThrow().getName());

        DrinkType added = store.insertDrinkType("Fritz Kola", "fritz_kola.png", 24);
        assertEquals(9, added.getId());
        assertThrows(ConflictException.class, () -> store.insertDrinkType("Club Mate", "", 0));
    }

    @Test
    @DisplayName("Postpaid users round-trip through the database")
    void postpaidRoundTrip() {
        Instant lastDrink = Instant.parse("2026-03-01T18:30:00Z");
        PostpaidUser alice = store.upsertPostpaid(PostpaidUser.create("alice", true));
        store.upsertPostpaid(alice.drink(150, lastDrink));

        PostpaidUser stored = store.getPostpaid("alice");
        assertEquals(alice.getId(), stored.getId());
        assertEquals(-150, stored.getMoney());
        assertEquals(lastDrink, stored.getLastDrink());
        assertEquals(stored, store.findPostpaidById(alice.getId()).orElseThrow());

        assertThrows(ConflictException.class, () -> store.upsertPostpaid(stored.withUsername("carol")));
    }

    @Test
    @DisplayName("Foreign key and unique constraints map to ledger failures")
    void constraintsMapToLedgerFailures() {
        PostpaidUser alice = store.upsertPostpaid(PostpaidUser.create("alice", true));

        assertThrows(NotFoundException.class,
            () -> store.upsertPrepaid(PrepaidUser.create("guest1", "key-1", 999L, 0)));

        store.upsertPrepaid(PrepaidUser.create("guest1", "key-1", alice.getId(), 0));
        assertThrows(ConflictException.class,
            () -> store.upsertPrepaid(PrepaidUser.create("guest2", "key-1", alice.getId(), 0)));
    }

    @Test
    @DisplayName("Other integrity violations are invalid input, not a missing owner")
    void nonForeignKeyViolationIsInvalidInput() {
        printTestHeader("Over-long prepaid username");

        PostpaidUser alice = store.upsertPostpaid(PostpaidUser.create("alice", true));
        String tooLong = "g".repeat(150);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> store.upsertPrepaid(PrepaidUser.create(tooLong, "key-long", alice.getId(), 0)));
        printOutput("Message", e.getMessage());

        assertThrows(IllegalArgumentException.class,
            () -> store.upsertPostpaid(PostpaidUser.create("a".repeat(150), true)));
        assertTrue(store.findPrepaidByKey("key-long").isEmpty());
        printSuccess("Rejected as invalid input");
    }

    @Test
    @DisplayName("Deleted prepaid users retire their key")
    void deleteRetiresKey() {
        PostpaidUser alice = store.upsertPostpaid(PostpaidUser.create("alice", true));
        store.upsertPrepaid(PrepaidUser.create("guest1", "key-1", alice.getId(), 0));

        store.deletePrepaid("guest1");

        assertTrue(store.findPrepaidByKey("key-1").isEmpty());
        assertTrue(store.isUserKeyTaken("key-1"));
        assertThrows(ConflictException.class,
            () -> store.upsertPrepaid(PrepaidUser.create("guest2", "key-1", alice.getId(), 0)));
        assertThrows(NotFoundException.class, () -> store.deletePrepaid("guest1"));
    }

    @Test
    @DisplayName("A failing transaction rolls back every write")
    void transactionRollsBack() {
        PostpaidUser alice = store.upsertPostpaid(PostpaidUser.create("alice", true));

        assertThrows(IllegalStateException.class, () -> store.runInTransaction(() -> {
            store.upsertPostpaid(alice.withMoney(5000));
            store.upsertPostpaid(PostpaidUser.create("bob", true));
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, store.getPostpaid("alice").getMoney());
        assertTrue(store.findPostpaid("bob").isEmpty());
    }

    @Test
    @DisplayName("Payup scenario against PostgreSQL")
    void payUpScenario() {
        printTestHeader("Payup against PostgreSQL");

        ledgerService.ensurePostpaidUser(ALICE);
        ledgerService.recordDrink(ALICE, DrinkTarget.selfPostpaid(), 150, null);
        ledgerService.ensurePostpaidUser(ADMIN);
        ledgerService.setMoneyPostpaid(ADMIN, "admin", 1000);

        ledgerService.payUp(ADMIN, "alice", 500);

        printOutput("admin", store.getPostpaid("admin").getMoney());
        printOutput("alice", store.getPostpaid("alice").getMoney());
        assertEquals(500, store.getPostpaid("admin").getMoney());
        assertEquals(350, store.getPostpaid("alice").getMoney());
        printSuccess("Balances settled");
    }

    @Test
    @DisplayName("Concurrent key drinks lose no update in PostgreSQL")
    void concurrentDrinks() throws Exception {
        printTestHeader("Concurrent drinks against PostgreSQL");

        ledgerService.ensurePostpaidUser(ALICE);
        PrepaidUser guest = ledgerService.addPrepaidUser(ALICE, "guest1", 5000);

        int numThreads = 8;
        int drinksPerThread = 10;
        ExecutorService executor = Executors.newFixedThreadPool(numThreads);
        CountDownLatch done = new CountDownLatch(numThreads);
        AtomicInteger failures = new AtomicInteger(0);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    for (int d = 0; d < drinksPerThread; d++) {
                        ledgerService.recordDrink(null, DrinkTarget.byKey(guest.getUserKey()), 25, 8);
                    }
                } catch (Exception e) {
                    failures.incrementAndGet();
                } finally {
                    done.countDown();
                }
            });
        }

        assertTrue(done.await(60, TimeUnit.SECONDS), "Drinks did not finish in time");
        executor.shutdown();

        long balance = store.getPrepaid("guest1").getMoney();
        printOutput("Final balance", balance);
        assertEquals(0, failures.get());
        assertEquals(5000 - numThreads * drinksPerThread * 25, balance);
        assertEquals(numThreads * drinksPerThread, store.findDrinkType(8).orElseThrow().getConsumed());
        printSuccess("No lost updates");
    }
}
