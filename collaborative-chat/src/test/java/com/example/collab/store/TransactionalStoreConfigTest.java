package com.example.collab.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import javax.sql.DataSource;
import org.junit.jupiter.api.Test;

class TransactionalStoreConfigTest {

    @Test
    void rowLockingDatabaseGetsAtomicStore() throws SQLException {
        assertThat(TransactionalStoreConfig.probe(dataSource(true, true))).isEqualTo(StoreMode.ATOMIC);
    }

    @Test
    void databaseWithoutSelectForUpdateGetsOptimisticStore() throws SQLException {
        assertThat(TransactionalStoreConfig.probe(dataSource(false, true))).isEqualTo(StoreMode.OPTIMISTIC);
    }

    @Test
    void unreachableDatabaseFallsBackToOptimisticStore() throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        when(dataSource.getConnection()).thenThrow(new SQLException("down"));

        assertThat(TransactionalStoreConfig.probe(dataSource)).isEqualTo(StoreMode.OPTIMISTIC);
    }

    private DataSource dataSource(boolean selectForUpdate, boolean transactions) throws SQLException {
        DataSource dataSource = mock(DataSource.class);
        Connection connection = mock(Connection.class);
        DatabaseMetaData metaData = mock(DatabaseMetaData.class);
        when(dataSource.getConnection()).thenReturn(connection);
        when(connection.getMetaData()).thenReturn(metaData);
        when(metaData.supportsSelectForUpdate()).thenReturn(selectForUpdate);
        when(metaData.supportsTransactions()).thenReturn(transactions);
        when(metaData.getDatabaseProductName()).thenReturn("TestDB");
        when(metaData.getDatabaseProductVersion()).thenReturn("1.0");
        return dataSource;
    }
}
