package com.skanga.sqlbridge.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Array;
import java.sql.Clob;
import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One leased connection with an open transaction. Closing the scope runs the safety-net rollback
 * (unless the transaction was already rolled back) and releases the connection exactly once.
 * A failing rollback is logged and counted, nothing more. The connection is released even if the
 * driver throws something other than {@link SQLException}.
 *
 * <p>Not thread-safe; a scope belongs to the single operation that opened it.
 */
final class TransactionScope implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TransactionScope.class);

    private final ConnectionPool connectionPool;
    private final Connection connection;
    private LifecycleState state;
    private int cleanupFailures;

    private TransactionScope(ConnectionPool connectionPool, Connection connection) {
        this.connectionPool = connectionPool;
        this.connection = connection;
        this.state = LifecycleState.ACQUIRED;
    }

    /**
     * Borrows a connection and starts a transaction in the given mode.
     * If starting the transaction fails the connection is released before the error is thrown.
     *
     * @param connectionPool Pool to borrow from
     * @param isolationMode Access mode of the transaction
     * @return an open scope
     * @throws SQLException if no connection could be acquired or the transaction could not begin
     */
    static TransactionScope begin(ConnectionPool connectionPool, IsolationMode isolationMode) throws SQLException {
        TransactionScope scope = new TransactionScope(connectionPool, connectionPool.acquire());
        try {
            // read-only must be set before the transaction begins
            scope.connection.setReadOnly(isolationMode == IsolationMode.READ_ONLY);
            scope.connection.setAutoCommit(false);
            scope.state = LifecycleState.TX_STARTED;
        } catch (SQLException e) {
            scope.close();
            throw e;
        }
        return scope;
    }

    /**
     * Executes the SQL text verbatim as a single statement batch.
     *
     * @param sqlText SQL supplied by the caller, not inspected
     * @return the first result set, or the update count when there is none
     * @throws SQLException if the engine rejects or fails the statement
     */
    QueryResult execute(String sqlText) throws SQLException {
        requireState(LifecycleState.TX_STARTED);
        long startTime = System.currentTimeMillis();

        List<String> resultColumns = new ArrayList<>();
        List<List<Object>> resultRows = new ArrayList<>();
        int rowCount;

        try (Statement statement = connection.createStatement()) {
            boolean isResultSet = statement.execute(sqlText);

            if (isResultSet) {
                try (ResultSet resultSet = statement.getResultSet()) {
                    ResultSetMetaData metaData = resultSet.getMetaData();
                    int columnCount = metaData.getColumnCount();

                    for (int i = 1; i <= columnCount; i++) {
                        resultColumns.add(metaData.getColumnLabel(i));
                    }

                    while (resultSet.next()) {
                        List<Object> currRow = new ArrayList<>(columnCount);
                        for (int i = 1; i <= columnCount; i++) {
                            currRow.add(readColumnValue(resultSet, i));
                        }
                        resultRows.add(currRow);
                    }
                }
                rowCount = resultRows.size();
            } else {
                // DDL reports 0 or -1 depending on the driver
                rowCount = Math.max(statement.getUpdateCount(), 0);
                resultColumns.add(QueryResult.AFFECTED_ROWS_COLUMN);
                List<Object> currRow = new ArrayList<>();
                currRow.add(rowCount);
                resultRows.add(currRow);
            }
        }

        state = LifecycleState.EXECUTED;
        return new QueryResult(resultColumns, resultRows, rowCount, System.currentTimeMillis() - startTime);
    }

    // Arrays and LOBs are only readable while the connection is open
    private static Object readColumnValue(ResultSet resultSet, int columnIndex) throws SQLException {
        Object columnValue = resultSet.getObject(columnIndex);
        if (columnValue instanceof Array) {
            Object arrayValue = ((Array) columnValue).getArray();
            return arrayValue instanceof Object[] ? Arrays.asList((Object[]) arrayValue) : String.valueOf(arrayValue);
        }
        if (columnValue instanceof Clob) {
            Clob clobValue = (Clob) columnValue;
            return clobValue.getSubString(1, (int) clobValue.length());
        }
        return columnValue;
    }

    void commit() throws SQLException {
        requireState(LifecycleState.EXECUTED);
        connection.commit();
        state = LifecycleState.COMMITTED;
    }

    /**
     * Rolls back after a failed execution or commit. A rollback failure is logged and the
     * scope stays eligible for the cleanup rollback.
     */
    void rollbackAfterFailure() {
        if (state.hasOpenTransaction()) {
            attemptRollback();
        }
    }

    private void attemptRollback() {
        try {
            connection.rollback();
            state = LifecycleState.ROLLED_BACK;
        } catch (SQLException e) {
            cleanupFailures++;
            logger.warn("Could not roll back transaction: {}", e.getMessage(), e);
        }
    }

    /**
     * Safety-net rollback followed by release. Runs on every exit path.
     */
    @Override
    public void close() {
        if (state == LifecycleState.RELEASED) {
            return;
        }
        try {
            if (state.hasOpenTransaction()) {
                attemptRollback();
            }
        } finally {
            connectionPool.release(connection);
            state = LifecycleState.RELEASED;
        }
    }

    private void requireState(LifecycleState expectedState) {
        if (state != expectedState) {
            throw new IllegalStateException("Expected lifecycle state " + expectedState + " but was " + state);
        }
    }

    LifecycleState state() {
        return state;
    }

    int cleanupFailures() {
        return cleanupFailures;
    }
}
