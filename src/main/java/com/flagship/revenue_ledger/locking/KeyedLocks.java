package com.flagship.revenue_ledger.locking;

import com.flagship.revenue_ledger.exception.LedgerPersistenceException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-process mutual exclusion per key (a client id, or a client/period pair).
 *
 * Different keys never contend. Acquisition is bounded by the caller's timeout;
 * failing to acquire the lock in time is reported as a persistence failure so the
 * caller retries later with the same idempotency key.
 *
 * A key's lock lives only while some thread holds it or waits for it, so the map
 * stays as small as the current contention whatever the key space.
 */
@Slf4j
public class KeyedLocks {

    private final String name;
    private final ConcurrentHashMap<String, Holder> locks = new ConcurrentHashMap<>();

    public KeyedLocks(String name) {
        this.name = name;
    }

    public <T> T withLock(String key, Duration timeout, Supplier<T> work) {
        Holder holder = acquireHolder(key);
        try {
            boolean acquired;
            try {
                acquired = holder.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LedgerPersistenceException("Interrupted while waiting for " + name + " lock on " + key, e);
            }
            if (!acquired) {
                log.warn("Timed out waiting for {} lock: key={}, timeoutMs={}", name, key, timeout.toMillis());
                throw new LedgerPersistenceException(
                        "Timed out after " + timeout.toMillis() + "ms waiting for " + name + " lock on " + key);
            }
            try {
                return work.get();
            } finally {
                holder.lock.unlock();
            }
        } finally {
            releaseHolder(key);
        }
    }

    /** Keys with a holder or a waiter. */
    int size() {
        return locks.size();
    }

    // users is only read and written inside the map's per-key compute functions
    private Holder acquireHolder(String key) {
        return locks.compute(key, (k, existing) -> {
            Holder holder = existing == null ? new Holder() : existing;
            holder.users++;
            return holder;
        });
    }

    private void releaseHolder(String key) {
        locks.computeIfPresent(key, (k, holder) -> --holder.users == 0 ? null : holder);
    }

    private static final class Holder {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
