package com.flagship.drink_ledger.transaction;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-key mutual exclusion for ledger records.
 *
 * Multiple keys are always acquired in sorted order, so two operations that
 * touch the same pair of records cannot deadlock. Acquisition is not
 * interruptible: once a unit of work has started it runs to completion.
 *
 * A lock entry lives only while some thread holds or waits for it, so keys
 * of failed lookups or deleted users do not accumulate.
 */
public class KeyedLocks {

    private final ConcurrentMap<String, Entry> locks = new ConcurrentHashMap<>();

    public static String postpaidKey(String username) {
        return "postpaid:" + username;
    }

    public static String prepaidKey(String username) {
        return "prepaid:" + username;
    }

    public static String drinkTypeKey(int id) {
        return "drink_type:" + id;
    }

    public <T> T withLocks(List<String> keys, Supplier<T> work) {
        List<String> ordered = keys.stream().distinct().sorted().toList();
        List<Entry> reserved = new ArrayList<>(ordered.size());
        int held = 0;
        try {
            for (String key : ordered) {
                reserved.add(reserve(key));
            }
            for (Entry entry : reserved) {
                entry.lock.lock();
                held++;
            }
            return work.get();
        } finally {
            for (int i = held - 1; i >= 0; i--) {
                reserved.get(i).lock.unlock();
            }
            for (int i = reserved.size() - 1; i >= 0; i--) {
                release(ordered.get(i));
            }
        }
    }

    /** Number of keys currently held or waited on. */
    int size() {
        return locks.size();
    }

    private Entry reserve(String key) {
        return locks.compute(key, (k, entry) -> {
            Entry current = entry == null ? new Entry() : entry;
            current.holders++;
            return current;
        });
    }

    private void release(String key) {
        locks.computeIfPresent(key, (k, entry) -> --entry.holders == 0 ? null : entry);
    }

    // holders is only touched inside compute, which runs under the map's bin lock
    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int holders;
    }
}
