package com.skanga.sqlbridge.db;

/**
 * One column of a table schema as reported by the engine's information schema.
 *
 * @param columnName Column name
 * @param dataType Engine-specific type name (e.g. {@code integer}, {@code text} on PostgreSQL)
 */
public record ColumnInfo(String columnName, String dataType) {
}
