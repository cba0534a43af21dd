package com.skanga.sqlbridge.tools;

/**
 * A request to run one tool.
 *
 * @param toolName Name of the tool, matched exactly against the catalog
 * @param sql SQL text, passed to the database unmodified; null when the caller sent none
 */
public record ToolInvocation(String toolName, String sql) {
    public ToolInvocation {
        if (toolName == null) {
            throw new IllegalArgumentException("Tool name cannot be null");
        }
    }
}
