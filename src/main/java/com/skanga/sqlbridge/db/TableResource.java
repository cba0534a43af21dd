package com.skanga.sqlbridge.db;

/**
 * A browsable handle to one table's schema.
 *
 * @param uri Identifier of the form {@code <base>/<table>/schema}
 * @param name Display label, e.g. {@code "users" database schema}
 * @param mimeType Always {@value #MIME_TYPE}
 */
public record TableResource(String uri, String name, String mimeType) {
    public static final String MIME_TYPE = "application/json";

    public TableResource {
        if (uri == null || uri.trim().isEmpty()) {
            throw new IllegalArgumentException("URI cannot be null or empty");
        }
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Name cannot be null or empty");
        }
    }

    static TableResource forTable(String uri, String tableName) {
        return new TableResource(uri, "\"" + tableName + "\" database schema", MIME_TYPE);
    }
}
