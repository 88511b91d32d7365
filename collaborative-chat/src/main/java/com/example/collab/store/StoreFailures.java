package com.example.collab.store;

import com.example.collab.service.exception.FailureReason;
import com.example.collab.service.exception.ServiceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

/**
 * Maps store exceptions onto service failures. Used by both store implementations and by reads that run outside a
 * unit of work.
 */
@Slf4j
public final class StoreFailures {

    private StoreFailures() {
    }

    static RuntimeException translate(String chatId, RuntimeException ex) {
        if (ex instanceof ConcurrentUpdateException) {
            log.debug("Giving up on chat {} after losing a concurrent update: {}", chatId, ex.getMessage());
            return new ServiceException(FailureReason.CONCURRENT_UPDATE,
                    "The chat was modified concurrently, please retry", ex);
        }
        if (isUnavailable(ex)) {
            return unavailable(chatId, ex);
        }
        return ex;
    }

    public static ServiceException unavailable(String chatId, RuntimeException ex) {
        log.error("Store unavailable while processing chat {}", chatId, ex);
        return new ServiceException(FailureReason.STORE_UNAVAILABLE, "Storage is temporarily unavailable", ex);
    }

    public static boolean isUnavailable(Throwable ex) {
        return ex instanceof DataAccessResourceFailureException
                || ex instanceof CannotCreateTransactionException
                || ex instanceof QueryTimeoutException;
    }
}
