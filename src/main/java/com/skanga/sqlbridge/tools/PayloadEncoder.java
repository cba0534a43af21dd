package com.skanga.sqlbridge.tools;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.skanga.sqlbridge.db.QueryResult;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Serializes structured results (column lists, query rows) as indented JSON text for transport.
 */
public final class PayloadEncoder {
    private static final ObjectMapper objectMapper = new ObjectMapper();
    private static final ObjectWriter prettyWriter;

    static {
        DefaultIndenter twoSpaceIndenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter prettyPrinter = new DefaultPrettyPrinter()
                .withObjectIndenter(twoSpaceIndenter)
                .withArrayIndenter(twoSpaceIndenter);
        prettyWriter = objectMapper.writer(prettyPrinter);
    }

    private PayloadEncoder() {
    }

    /**
     * @param payload Any Jackson-serializable value
     * @return indented JSON text
     * @throws IllegalStateException if the value cannot be serialized
     */
    public static String encode(Object payload) {
        try {
            return prettyWriter.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize payload: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Encodes query rows as an array of objects keyed by column label.
     * Values without a natural JSON form (timestamps, driver objects) are written as their string form.
     */
    public static String encodeRows(QueryResult queryResult) {
        List<Map<String, Object>> jsonRows = new ArrayList<>();
        for (Map<String, Object> rowMap : queryResult.rowsAsMaps()) {
            Map<String, Object> jsonRow = new LinkedHashMap<>();
            rowMap.forEach((columnLabel, columnValue) -> jsonRow.put(columnLabel, toJsonValue(columnValue)));
            jsonRows.add(jsonRow);
        }
        return encode(jsonRows);
    }

    static Object toJsonValue(Object columnValue) {
        if (columnValue == null || columnValue instanceof String || columnValue instanceof Number
                || columnValue instanceof Boolean || columnValue instanceof byte[]) {
            return columnValue;
        }
        if (columnValue instanceof List<?>) {
            List<Object> jsonList = new ArrayList<>();
            for (Object element : (List<?>) columnValue) {
                jsonList.add(toJsonValue(element));
            }
            return jsonList;
        }
        return columnValue.toString();
    }
}
