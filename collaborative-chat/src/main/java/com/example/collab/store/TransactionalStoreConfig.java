package com.example.collab.store;

import com.example.collab.config.CollabProperties;
import com.example.collab.persistence.ChatSessionJpaRepository;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

@Slf4j
@Configuration
public class TransactionalStoreConfig {

    @Bean
    public TransactionalStore transactionalStore(
            CollabProperties properties,
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            ChatSessionJpaRepository sessionRepository) {
        StoreMode mode = properties.getStore().getMode();
        if (mode == null || mode == StoreMode.AUTO) {
            mode = probe(dataSource);
        }
        log.info("Using {} transactional store", mode);
        if (mode == StoreMode.ATOMIC) {
            return new AtomicTransactionStore(new TransactionTemplate(transactionManager), sessionRepository);
        }
        return new OptimisticRetryStore();
    }

    static StoreMode probe(DataSource dataSource) {
        try (Connection connection = dataSource.getConnection()) {
            DatabaseMetaData metaData = connection.getMetaData();
            boolean atomic = metaData.supportsSelectForUpdate() && metaData.supportsTransactions();
            log.debug("{} {}: selectForUpdate/transactions supported = {}",
                    metaData.getDatabaseProductName(), metaData.getDatabaseProductVersion(), atomic);
            return atomic ? StoreMode.ATOMIC : StoreMode.OPTIMISTIC;
        } catch (SQLException ex) {
            log.warn("Could not probe database capabilities, falling back to optimistic store", ex);
            return StoreMode.OPTIMISTIC;
        }
    }
}
