package com.skanga.sqlbridge.db;

/**
 * Access mode a tool's transaction is started in.
 * Writes under {@link #READ_ONLY} are rejected by the engine, not by this server.
 */
public enum IsolationMode {
    READ_ONLY,
    READ_WRITE
}
