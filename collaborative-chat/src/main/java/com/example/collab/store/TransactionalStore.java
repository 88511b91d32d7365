package com.example.collab.store;

import java.util.function.Function;

/**
 * Runs a unit of work against the relational store so that, per chat, it behaves as if serialized with every other
 * unit touching the same chat.
 *
 * <p>Business logic is written once against this interface. Implementations differ in how they guarantee it:
 * {@link AtomicTransactionStore} uses one database transaction plus a row lock, {@link OptimisticRetryStore} relies
 * on conditional writes, compensations and a single retry.
 */
public interface TransactionalStore {

    /**
     * @param chatId chat whose state the unit mutates; may be a chat that does not exist yet
     * @param work the unit of work; must be safe to run twice
     * @throws com.example.collab.service.exception.ServiceException with {@code CONCURRENT_UPDATE} when the unit lost
     *     a race it could not recover from, or {@code STORE_UNAVAILABLE} when the database could not be reached
     */
    <T> T execute(String chatId, Function<StoreTransaction, T> work);

    StoreMode mode();
}
