package com.fiscaladmin.gam.transactionimporter.persister;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Serializes commits that touch the same account while letting commits for
 * different accounts run in parallel.
 * <p>
 * Account locks are always acquired in ascending id order, so two batches that
 * share several accounts cannot deadlock. Store-wide operations (clear all data)
 * take the exclusive side of a read/write lock; every batch holds the shared side.
 * <p>
 * One lock exists per account id seen; {@link #forget(String)} drops it when the
 * account is deleted. Account ids are never reused, so a commit still waiting on a
 * forgotten lock can only fail on the missing account.
 */
public class AccountLocks {

    private final ConcurrentMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final ReadWriteLock storeLock = new ReentrantReadWriteLock();
    private final Duration timeout;

    public AccountLocks(Duration timeout) {
        this.timeout = timeout;
    }

    /**
     * Acquires the shared store lock and one lock per account.
     *
     * @return a handle that releases everything on close
     * @throws StorageException if any lock is not obtained within the timeout
     */
    public Held lockAccounts(Collection<String> accountIds) {
        Lock shared = storeLock.readLock();
        acquire(shared, "store");
        List<Lock> held = new ArrayList<>();
        held.add(shared);
        try {
            for (String accountId : new TreeSet<>(accountIds)) {
                Lock lock = locks.computeIfAbsent(accountId, id -> new ReentrantLock());
                acquire(lock, "account " + accountId);
                held.add(lock);
            }
        } catch (RuntimeException e) {
            release(held);
            throw e;
        }
        return new Held(held);
    }

    /**
     * Acquires the exclusive store lock, waiting for in-flight batches to finish.
     */
    public Held lockStore() {
        Lock exclusive = storeLock.writeLock();
        acquire(exclusive, "store");
        List<Lock> held = new ArrayList<>();
        held.add(exclusive);
        return new Held(held);
    }

    /**
     * Drops the lock of a deleted account. Call while holding that lock.
     */
    public void forget(String accountId) {
        locks.remove(accountId);
    }

    int trackedAccountCount() {
        return locks.size();
    }

    private void acquire(Lock lock, String what) {
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StorageException("Interrupted while waiting for lock on " + what, e);
        }
        if (!acquired) {
            throw new StorageException("Timed out after " + timeout.toMillis() + " ms waiting for lock on " + what);
        }
    }

    private static void release(List<Lock> held) {
        for (int i = held.size() - 1; i >= 0; i--) {
            held.get(i).unlock();
        }
    }

    /**
     * Locks held by the current thread; release with try-with-resources.
     */
    public static class Held implements AutoCloseable {

        private final List<Lock> held;

        private Held(List<Lock> held) {
            this.held = held;
        }

        @Override
        public void close() {
            release(held);
        }
    }
}
