package com.skanga.sqlbridge.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;

/**
 * Runs one SQL text through acquire, begin, execute, commit-or-rollback and release under a
 * {@link TransactionPolicy}.
 *
 * <p>Failures at acquire, begin, execute or commit come back as a failed {@link ExecutionResult}
 * carrying the original {@link SQLException}. Whatever happens, an acquired connection gets a
 * rollback attempt (skipped only if already rolled back) and is released once. Rollback failures
 * are logged at WARN and never change the result.
 *
 * <p>Thread-safe: each call works on its own leased connection, the pool is the only shared state.
 */
public class TransactionLifecycle {
    private static final Logger logger = LoggerFactory.getLogger(TransactionLifecycle.class);

    private final ConnectionPool connectionPool;

    public TransactionLifecycle(ConnectionPool connectionPool) {
        this.connectionPool = connectionPool;
    }

    /**
     * Executes the SQL text under the given policy.
     *
     * @param transactionPolicy Access mode and commit rule
     * @param sqlText SQL passed through verbatim
     * @return the statement's result, or the error that stopped it
     */
    public ExecutionResult execute(TransactionPolicy transactionPolicy, String sqlText) {
        final TransactionScope scope;
        try {
            scope = TransactionScope.begin(connectionPool, transactionPolicy.isolationMode());
        } catch (SQLException e) {
            logger.warn("Could not start {} transaction: {}", transactionPolicy.isolationMode(), e.getMessage());
            return ExecutionResult.failure(e);
        }

        try (scope) {
            try {
                QueryResult queryResult = scope.execute(sqlText);
                if (transactionPolicy.commitOnSuccess()) {
                    scope.commit();
                }
                return ExecutionResult.success(queryResult);
            } catch (SQLException e) {
                logger.warn("SQL execution failed: {}", e.getMessage());
                scope.rollbackAfterFailure();
                return ExecutionResult.failure(e);
            }
        }
    }
}
