package com.flagship.drink_ledger.store;

import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.ledger.exception.NotFoundException;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Durable keyed storage for postpaid users, prepaid users and drink types.
 *
 * Every single-record operation is atomic. Multi-record units of work go
 * through {@link #inTransaction(Supplier)}, which makes all their writes
 * visible together or not at all.
 *
 * Failures:
 * - {@link NotFoundException} for unknown keys on get/delete
 * - {@link com.flagship.drink_ledger.ledger.exception.ConflictException} when an upsert
 *   would change a record's identity or collide with a unique key
 * - {@link com.flagship.drink_ledger.ledger.exception.StoreUnavailableException} when
 *   the backing storage cannot be reached
 */
public interface LedgerStore {

    Optional<PostpaidUser> findPostpaid(String username);

    Optional<PostpaidUser> findPostpaidById(long id);

    default PostpaidUser getPostpaid(String username) {
        return findPostpaid(username)
            .orElseThrow(() -> new NotFoundException("Postpaid user not found: " + username));
    }

    /**
     * @return all postpaid users in insertion order
     */
    List<PostpaidUser> listPostpaid();

    /**
     * Inserts the user if its username is unknown, otherwise replaces the
     * stored record.
     *
     * @return the stored record, with its id assigned
     */
    PostpaidUser upsertPostpaid(PostpaidUser user);

    Optional<PrepaidUser> findPrepaid(String username);

    default PrepaidUser getPrepaid(String username) {
        return findPrepaid(username)
            .orElseThrow(() -> new NotFoundException("Prepaid user not found: " + username));
    }

    Optional<PrepaidUser> findPrepaidByKey(String userKey);

    List<PrepaidUser> listPrepaidByOwner(long postpaidUserId);

    List<PrepaidUser> listPrepaid();

    /**
     * Same identity rules as {@link #upsertPostpaid}. The owner must exist and
     * the user key must be neither taken by another record nor retired.
     */
    PrepaidUser upsertPrepaid(PrepaidUser user);

    /**
     * Removes the prepaid user and retires its user key for the lifetime of
     * the store.
     */
    void deletePrepaid(String username);

    /**
     * @return true if the key belongs to a live prepaid user or was retired
     */
    boolean isUserKeyTaken(String userKey);

    List<DrinkType> listDrinkTypes();

    Optional<DrinkType> findDrinkType(int id);

    DrinkType insertDrinkType(String name, String icon, int quantity);

    DrinkType updateDrinkType(DrinkType drinkType);

    /**
     * Runs the work as one atomic unit. Nested calls join the outer unit.
     */
    <T> T inTransaction(Supplier<T> work);

    default void runInTransaction(Runnable work) {
        inTransaction(() -> {
            work.run();
            return null;
        });
    }

    boolean isAvailable();
}
