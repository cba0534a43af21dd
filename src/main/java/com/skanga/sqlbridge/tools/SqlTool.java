package com.skanga.sqlbridge.tools;

import com.skanga.sqlbridge.db.QueryResult;
import com.skanga.sqlbridge.db.TransactionPolicy;

import java.util.function.Function;

/**
 * The fixed tool catalog. Each tool pairs a transaction policy with the way a successful
 * result is reported. Every tool takes exactly one required string argument, {@value #SQL_ARGUMENT}.
 */
public enum SqlTool {
    QUERY("query", "Run a read-only SQL query",
            TransactionPolicy.READ_ONLY, PayloadEncoder::encodeRows),
    CREATE("create", "Run a create-table SQL query",
            TransactionPolicy.READ_WRITE_COMMIT, queryResult -> "Table created successfully"),
    // No commit: the cleanup rollback discards the inserted rows. Switching to
    // READ_WRITE_COMMIT makes inserts durable; InsertDeleteDurabilityTest pins the current behavior.
    INSERT("insert", "Run an insert-data SQL query",
            TransactionPolicy.READ_WRITE_NO_COMMIT, queryResult -> "Data inserted successfully"),
    UPDATE("update", "Run an update-data SQL query",
            TransactionPolicy.READ_WRITE_COMMIT, queryResult -> "Data updated successfully"),
    // Same as INSERT: deletions are rolled back.
    DELETE("delete", "Run a delete-data SQL query",
            TransactionPolicy.READ_WRITE_NO_COMMIT, queryResult -> "Data deleted successfully");

    public static final String SQL_ARGUMENT = "sql";

    private final String toolName;
    private final String description;
    private final TransactionPolicy transactionPolicy;
    private final Function<QueryResult, String> resultRenderer;

    SqlTool(String toolName, String description, TransactionPolicy transactionPolicy,
            Function<QueryResult, String> resultRenderer) {
        this.toolName = toolName;
        this.description = description;
        this.transactionPolicy = transactionPolicy;
        this.resultRenderer = resultRenderer;
    }

    public String toolName() {
        return toolName;
    }

    public String description() {
        return description;
    }

    public TransactionPolicy transactionPolicy() {
        return transactionPolicy;
    }

    String renderResult(QueryResult queryResult) {
        return resultRenderer.apply(queryResult);
    }
}
