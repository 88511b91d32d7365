package com.example.collab.store;

public enum StoreMode {
    /** Pick {@link #ATOMIC} when the database supports row locks and transactions, else {@link #OPTIMISTIC}. */
    AUTO,
    ATOMIC,
    OPTIMISTIC
}
