package com.example.collab.store;

import com.example.collab.persistence.ChatSessionJpaRepository;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

/**
 * One database transaction per unit of work. The chat's session row is locked ({@code SELECT ... FOR UPDATE}) first,
 * so units on the same chat queue up behind each other while other chats proceed. Rollback replaces compensations.
 */
@Slf4j
@RequiredArgsConstructor
public class AtomicTransactionStore implements TransactionalStore {

    private static final StoreTransaction ROLLBACK_ONLY = compensation -> {
    };

    private final TransactionTemplate transactionTemplate;
    private final ChatSessionJpaRepository sessionRepository;

    @Override
    public <T> T execute(String chatId, Function<StoreTransaction, T> work) {
        try {
            return transactionTemplate.execute(status -> {
                if (StringUtils.hasText(chatId)) {
                    sessionRepository.lockById(chatId);
                }
                return work.apply(ROLLBACK_ONLY);
            });
        } catch (RuntimeException ex) {
            throw StoreFailures.translate(chatId, ex);
        }
    }

    @Override
    public StoreMode mode() {
        return StoreMode.ATOMIC;
    }
}
