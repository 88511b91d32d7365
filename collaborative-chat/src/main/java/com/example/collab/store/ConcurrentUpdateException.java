package com.example.collab.store;

/**
 * A compare-and-swap write lost against a concurrent writer.
 */
public class ConcurrentUpdateException extends RuntimeException {

    public ConcurrentUpdateException(String operation) {
        super("Concurrent update detected during " + operation, null, false, false);
    }
}
