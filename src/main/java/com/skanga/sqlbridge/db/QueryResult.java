package com.skanga.sqlbridge.db;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable result of executing one SQL text.
 * Statements that return no result set are reported as a single {@value #AFFECTED_ROWS_COLUMN} row.
 *
 * @param allColumns Column labels in result set order
 * @param allRows Data rows, each a list of column values
 * @param rowCount Rows returned, or rows affected for update statements
 * @param executionTimeMs Time taken to execute in milliseconds
 */
public record QueryResult(List<String> allColumns, List<List<Object>> allRows, int rowCount, long executionTimeMs) {
    public static final String AFFECTED_ROWS_COLUMN = "affected_rows";

    public QueryResult {
        if (allColumns == null) {
            throw new IllegalArgumentException("Columns cannot be null");
        }
        if (allRows == null) {
            throw new IllegalArgumentException("Rows cannot be null");
        }
        if (executionTimeMs < 0) {
            throw new IllegalArgumentException("Execution time cannot be negative");
        }
    }

    /**
     * Rows as column-label keyed maps, in column order. A label that repeats keeps its last value.
     */
    public List<Map<String, Object>> rowsAsMaps() {
        List<Map<String, Object>> rowMaps = new ArrayList<>(allRows.size());
        for (List<Object> currRow : allRows) {
            Map<String, Object> rowMap = new LinkedHashMap<>();
            for (int i = 0; i < allColumns.size(); i++) {
                rowMap.put(allColumns.get(i), i < currRow.size() ? currRow.get(i) : null);
            }
            rowMaps.add(rowMap);
        }
        return rowMaps;
    }
}
