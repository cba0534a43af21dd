package com.skanga.sqlbridge.tools;

import com.skanga.sqlbridge.config.ResourceManager;
import com.skanga.sqlbridge.db.ExecutionResult;
import com.skanga.sqlbridge.db.TransactionLifecycle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes tool invocations by name to the transaction lifecycle with the tool's policy.
 * Unknown names are rejected before a connection is borrowed. The SQL text is never inspected.
 */
public class ToolDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ToolDispatcher.class);
    private static final Logger securityLogger = LoggerFactory.getLogger("SECURITY." + ToolDispatcher.class.getName());

    private static final Map<String, SqlTool> toolsByName = new LinkedHashMap<>();

    static {
        for (SqlTool sqlTool : SqlTool.values()) {
            toolsByName.put(sqlTool.toolName(), sqlTool);
        }
    }

    private final TransactionLifecycle transactionLifecycle;

    public ToolDispatcher(TransactionLifecycle transactionLifecycle) {
        this.transactionLifecycle = transactionLifecycle;
    }

    /**
     * @return the static catalog in declaration order
     */
    public List<SqlTool> listTools() {
        return Collections.unmodifiableList(Arrays.asList(SqlTool.values()));
    }

    /**
     * Runs a tool invocation.
     *
     * @param toolInvocation Tool name and SQL text
     * @return the tool's result; database failures come back with {@code isError} set
     * @throws UnknownToolException if the name is not in the catalog
     * @throws IllegalArgumentException if no SQL text was supplied
     */
    public ToolResult callTool(ToolInvocation toolInvocation) {
        SqlTool sqlTool = toolsByName.get(toolInvocation.toolName());
        if (sqlTool == null) {
            throw new UnknownToolException(toolInvocation.toolName());
        }

        String sqlText = toolInvocation.sql();
        if (sqlText == null) {
            throw new IllegalArgumentException(
                    ResourceManager.getErrorMessage("protocol.params.missing", SqlTool.SQL_ARGUMENT));
        }

        securityLogger.warn("SECURITY_EVENT: SQL_EXECUTION - Tool: {}, Mode: {}, Commit: {}, Query length: {}",
                sqlTool.toolName(), sqlTool.transactionPolicy().isolationMode(),
                sqlTool.transactionPolicy().commitOnSuccess(), sqlText.length());

        ExecutionResult executionResult = transactionLifecycle.execute(sqlTool.transactionPolicy(), sqlText);
        if (!executionResult.isSuccess()) {
            return ToolResult.failure(executionResult.error());
        }

        logger.debug("Tool {} succeeded in {}ms", sqlTool.toolName(), executionResult.queryResult().executionTimeMs());
        return ToolResult.success(sqlTool.renderResult(executionResult.queryResult()));
    }
}
