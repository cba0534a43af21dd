package com.skanga.sqlbridge.tools;

import java.sql.SQLException;

/**
 * Normalized outcome of a tool call: a single text payload and an error flag.
 * On failure the original database error is kept alongside its message.
 *
 * @param text Success message, JSON rows, or the error message
 * @param isError Whether the call failed
 * @param error The original execution error, null on success
 */
public record ToolResult(String text, boolean isError, SQLException error) {

    public static ToolResult success(String text) {
        return new ToolResult(text, false, null);
    }

    public static ToolResult failure(SQLException error) {
        String errorText = error.getMessage() != null ? error.getMessage() : error.toString();
        return new ToolResult(errorText, true, error);
    }
}
