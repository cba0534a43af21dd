package com.skanga.sqlbridge.tools;

import com.skanga.sqlbridge.config.ResourceManager;

/**
 * A tool invocation named a tool outside the fixed catalog. Raised before any connection is borrowed.
 */
public class UnknownToolException extends IllegalArgumentException {
    private final String toolName;

    public UnknownToolException(String toolName) {
        super(ResourceManager.getErrorMessage("tool.unknown", toolName));
        this.toolName = toolName;
    }

    public String getToolName() {
        return toolName;
    }
}
