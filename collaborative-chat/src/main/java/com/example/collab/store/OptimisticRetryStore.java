package com.example.collab.store;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;

/**
 * For databases without row locks. Each write of a unit is its own conditional update; when one of them loses,
 * the writes already made are compensated in reverse order and the unit is run once more. Between a write and its
 * compensation other readers can observe the intermediate state.
 */
@Slf4j
public class OptimisticRetryStore implements TransactionalStore {

    private static final int MAX_ATTEMPTS = 2;

    @Override
    public <T> T execute(String chatId, Function<StoreTransaction, T> work) {
        int attempt = 1;
        while (true) {
            Deque<Runnable> compensations = new ArrayDeque<>();
            try {
                return work.apply(compensations::push);
            } catch (RuntimeException ex) {
                runCompensations(chatId, compensations);
                if (ex instanceof ConcurrentUpdateException && attempt < MAX_ATTEMPTS) {
                    log.debug("Retrying unit of work for chat {} after: {}", chatId, ex.getMessage());
                    attempt++;
                    continue;
                }
                throw StoreFailures.translate(chatId, ex);
            }
        }
    }

    @Override
    public StoreMode mode() {
        return StoreMode.OPTIMISTIC;
    }

    private void runCompensations(String chatId, Deque<Runnable> compensations) {
        while (!compensations.isEmpty()) {
            Runnable compensation = compensations.pop();
            try {
                compensation.run();
            } catch (RuntimeException ex) {
                log.error("Compensation failed for chat {}; state may need manual repair", chatId, ex);
            }
        }
    }
}
