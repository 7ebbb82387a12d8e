// Copyright (c) 2025, Digital Asset (Switzerland) GmbH and/or its affiliates. All rights reserved.
// SPDX-License-Identifier: 0BSD

package com.pumpfud.launchpad.engine;

import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * One read/write lock per token id.
 *
 * Mutations of a token's record or balances hold its write lock; composite reads hold the read
 * lock. Locks of different tokens are independent.
 *
 * A lock exists only for ids handed out by creation ({@link #register}). Lookups of any other id
 * return empty without touching the map, so unknown ids never allocate.
 */
@Component
public class TokenLocks {

    private final Map<Long, ReentrantReadWriteLock> locks = new ConcurrentHashMap<>();

    /**
     * Creates the lock for an id about to be created. Ids are dense and a failed creation hands
     * its id to the next one, so the map stays bounded by the token count plus one.
     */
    void register(final long tokenId) {
        locks.computeIfAbsent(tokenId, id -> new ReentrantReadWriteLock(true));
    }

    /**
     * Runs {@code action} under the write lock, or returns empty when the id was never registered.
     */
    public <T> Optional<T> withWriteLock(final long tokenId, final Supplier<T> action) {
        return Optional.ofNullable(locks.get(tokenId)).map(lock -> run(lock.writeLock(), action));
    }

    /**
     * Runs {@code action} under the read lock, or returns empty when the id was never registered.
     */
    public <T> Optional<T> withReadLock(final long tokenId, final Supplier<T> action) {
        return Optional.ofNullable(locks.get(tokenId)).map(lock -> run(lock.readLock(), action));
    }

    int size() {
        return locks.size();
    }

    private static <T> T run(final Lock lock, final Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
