package com.skanga.sqlbridge.db;

import java.sql.SQLException;

/**
 * Outcome of one run through the transaction lifecycle: either the statement's result or the
 * error that stopped it. Cleanup problems are never recorded here.
 *
 * @param queryResult Result of the statement, null on failure
 * @param error The original failure, null on success
 */
public record ExecutionResult(QueryResult queryResult, SQLException error) {
    public ExecutionResult {
        if ((queryResult == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of result and error must be set");
        }
    }

    public static ExecutionResult success(QueryResult queryResult) {
        return new ExecutionResult(queryResult, null);
    }

    public static ExecutionResult failure(SQLException error) {
        return new ExecutionResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
