package com.flagship.drink_ledger.store;

import com.flagship.drink_ledger.ledger.DrinkType;
import com.flagship.drink_ledger.ledger.PostpaidUser;
import com.flagship.drink_ledger.ledger.PrepaidUser;
import com.flagship.drink_ledger.ledger.exception.ConflictException;
import com.flagship.drink_ledger.ledger.exception.NotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * Ledger store kept in process memory.
 *
 * Readers share a read lock; a transaction holds the write lock for its whole
 * duration, so no reader observes half of a multi-record unit. Writes inside a
 * transaction push undo actions which are replayed if the work throws.
 *
 * Records are immutable values, so handing them out needs no copying.
 */
@Slf4j
public class InMemoryLedgerStore implements LedgerStore {

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<String, PostpaidUser> postpaidByUsername = new LinkedHashMap<>();
    private final Map<String, PrepaidUser> prepaidByUsername = new LinkedHashMap<>();
    private final Map<Integer, DrinkType> drinkTypes = new LinkedHashMap<>();
    private final Set<String> retiredUserKeys = new HashSet<>();

    private long nextPostpaidId = 1;
    private long nextPrepaidId = 1;
    private int nextDrinkTypeId = 1;

    // Only touched while holding the write lock
    private Deque<Runnable> undoLog;
    private int transactionDepth;

    @Override
    public Optional<PostpaidUser> findPostpaid(String username) {
        return read(() -> Optional.ofNullable(postpaidByUsername.get(username)));
    }

    @Override
    public Optional<PostpaidUser> findPostpaidById(long id) {
        return read(() -> postpaidByUsername.values().stream()
            .filter(user -> user.getId() == id)
            .findFirst());
    }

    @Override
    public List<PostpaidUser> listPostpaid() {
        return read(() -> List.copyOf(postpaidByUsername.values()));
    }

    @Override
    public PostpaidUser upsertPostpaid(PostpaidUser user) {
        return write(() -> {
            PostpaidUser existing = postpaidByUsername.get(user.getUsername());
            PostpaidUser stored;
            if (existing == null) {
                if (user.getId() != null) {
                    throw new ConflictException(
                        "Postpaid user " + user.getId() + " cannot be renamed to " + user.getUsername());
                }
                stored = user.withId(nextPostpaidId++);
            } else {
                if (user.getId() != null && !user.getId().equals(existing.getId())) {
                    throw new ConflictException("Username already taken: " + user.getUsername());
                }
                stored = user.withId(existing.getId());
            }
            put(postpaidByUsername, stored.getUsername(), stored);
            return stored;
        });
    }

    @Override
    public Optional<PrepaidUser> findPrepaid(String username) {
        return read(() -> Optional.ofNullable(prepaidByUsername.get(username)));
    }

    @Override
    public Optional<PrepaidUser> findPrepaidByKey(String userKey) {
        return read(() -> prepaidByUsername.values().stream()
            .filter(user -> user.getUserKey().equals(userKey))
            .findFirst());
    }

    @Override
    public List<PrepaidUser> listPrepaidByOwner(long postpaidUserId) {
        return read(() -> prepaidByUsername.values().stream()
            .filter(user -> user.getPostpaidUserId() == postpaidUserId)
            .toList());
    }

    @Override
    public List<PrepaidUser> listPrepaid() {
        return read(() -> List.copyOf(prepaidByUsername.values()));
    }

    @Override
    public PrepaidUser upsertPrepaid(PrepaidUser user) {
        return write(() -> {
            PrepaidUser existing = prepaidByUsername.get(user.getUsername());
            if (existing == null && user.getId() != null) {
                throw new ConflictException(
                    "Prepaid user " + user.getId() + " cannot be renamed to " + user.getUsername());
            }
            if (existing != null && user.getId() != null && !user.getId().equals(existing.getId())) {
                throw new ConflictException("Username already taken: " + user.getUsername());
            }
            boolean ownerExists = postpaidByUsername.values().stream()
                .anyMatch(owner -> owner.getId() == user.getPostpaidUserId());
            if (!ownerExists) {
                throw new NotFoundException("Owning postpaid user not found: " + user.getPostpaidUserId());
            }
            if (retiredUserKeys.contains(user.getUserKey())) {
                throw new ConflictException("User key has been retired");
            }
            boolean keyTakenByOther = prepaidByUsername.values().stream()
                .anyMatch(other -> other.getUserKey().equals(user.getUserKey())
                    && !other.getUsername().equals(user.getUsername()));
            if (keyTakenByOther) {
                throw new ConflictException("User key already in use");
            }

            PrepaidUser stored = existing == null
                ? user.withId(nextPrepaidId++)
                : user.withId(existing.getId());
            put(prepaidByUsername, stored.getUsername(), stored);
            return stored;
        });
    }

    @Override
    public void deletePrepaid(String username) {
        write(() -> {
            PrepaidUser removed = prepaidByUsername.remove(username);
            if (removed == null) {
                throw new NotFoundException("Prepaid user not found: " + username);
            }
            retiredUserKeys.add(removed.getUserKey());
            recordUndo(() -> {
                retiredUserKeys.remove(removed.getUserKey());
                prepaidByUsername.put(username, removed);
            });
            return null;
        });
    }

    @Override
    public boolean isUserKeyTaken(String userKey) {
        return read(() -> retiredUserKeys.contains(userKey)
            || prepaidByUsername.values().stream().anyMatch(user -> user.getUserKey().equals(userKey)));
    }

    @Override
    public List<DrinkType> listDrinkTypes() {
        return read(() -> List.copyOf(drinkTypes.values()));
    }

    @Override
    public Optional<DrinkType> findDrinkType(int id) {
        return read(() -> Optional.ofNullable(drinkTypes.get(id)));
    }

    @Override
    public DrinkType insertDrinkType(String name, String icon, int quantity) {
        return write(() -> {
            boolean nameTaken = drinkTypes.values().stream().anyMatch(type -> type.getName().equals(name));
            if (nameTaken) {
                throw new ConflictException("Drink type already exists: " + name);
            }
            DrinkType created = new DrinkType(nextDrinkTypeId++, name, icon, quantity, 0L);
            put(drinkTypes, created.getId(), created);
            return created;
        });
    }

    @Override
    public DrinkType updateDrinkType(DrinkType drinkType) {
        return write(() -> {
            DrinkType existing = drinkTypes.get(drinkType.getId());
            if (existing == null) {
                throw new NotFoundException("Drink type not found: " + drinkType.getId());
            }
            if (!existing.getName().equals(drinkType.getName())) {
                throw new ConflictException("Drink type " + drinkType.getId() + " cannot be renamed");
            }
            put(drinkTypes, drinkType.getId(), drinkType);
            return drinkType;
        });
    }

    @Override
    public <T> T inTransaction(Supplier<T> work) {
        lock.writeLock().lock();
        try {
            if (transactionDepth++ == 0) {
                undoLog = new ArrayDeque<>();
            }
            try {
                T result = work.get();
                if (transactionDepth == 1) {
                    undoLog = null;
                }
                return result;
            } catch (RuntimeException | Error e) {
                if (transactionDepth == 1) {
                    rollback();
                }
                throw e;
            } finally {
                transactionDepth--;
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private void rollback() {
        log.debug("Rolling back {} in-memory writes", undoLog.size());
        while (!undoLog.isEmpty()) {
            undoLog.pop().run();
        }
        undoLog = null;
    }

    private <K, V> void put(Map<K, V> map, K key, V value) {
        V previous = map.put(key, value);
        recordUndo(() -> {
            if (previous == null) {
                map.remove(key);
            } else {
                map.put(key, previous);
            }
        });
    }

    private void recordUndo(Runnable undo) {
        if (undoLog != null) {
            undoLog.push(undo);
        }
    }

    private <T> T read(Supplier<T> reader) {
        lock.readLock().lock();
        try {
            return reader.get();
        } finally {
            lock.readLock().unlock();
        }
    }

    private <T> T write(Supplier<T> writer) {
        return inTransaction(writer);
    }

    /**
     * Seeds the given drink types, in order, starting at id 1.
     */
    public InMemoryLedgerStore withDrinkTypes(List<String> names) {
        runInTransaction(() -> names.forEach(name -> insertDrinkType(name, iconFor(name), 0)));
        return this;
    }

    private static String iconFor(String name) {
        return name.toLowerCase().replace(' ', '_') + ".png";
    }
}
