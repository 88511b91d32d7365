package com.example.collab.store;

/**
 * Handle passed to a unit of work while it runs inside a {@link TransactionalStore}.
 */
@FunctionalInterface
public interface StoreTransaction {

    /**
     * Registers an undo action for a write that already happened. Compensations only run when the store cannot
     * roll the unit back itself, in reverse registration order.
     */
    void compensate(Runnable compensation);

    /**
     * Fails the unit of work when a conditional write matched no row.
     */
    default void requireUpdated(int affectedRows, String operation) {
        if (affectedRows == 0) {
            throw new ConcurrentUpdateException(operation);
        }
    }
}
