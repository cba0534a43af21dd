package com.skanga.sqlbridge.tools;

import com.skanga.sqlbridge.db.ColumnInfo;
import com.skanga.sqlbridge.db.QueryResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.sql.Timestamp;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PayloadEncoderTest {

    @Test
    @DisplayName("Should encode column lists as indented JSON")
    void shouldEncodeColumns() {
        String payload = PayloadEncoder.encode(List.of(new ColumnInfo("id", "integer")));

        assertThat(payload).isEqualTo(String.join("\n",
                "[",
                "  {",
                "    \"columnName\" : \"id\",",
                "    \"dataType\" : \"integer\"",
                "  }",
                "]"));
    }

    @Test
    @DisplayName("Should encode an empty list as an empty array")
    void shouldEncodeEmptyList() {
        assertThat(PayloadEncoder.encode(List.of())).isEqualTo("[ ]");
    }

    @Test
    @DisplayName("Should keep nulls and numbers and stringify driver values")
    void shouldConvertColumnValues() {
        Timestamp createdAt = Timestamp.valueOf("2024-01-02 03:04:05");
        QueryResult queryResult = new QueryResult(List.of("total", "note", "created_at"),
                List.of(Arrays.asList(new BigDecimal("25.50"), null, createdAt)), 1, 0);

        String payload = PayloadEncoder.encodeRows(queryResult);

        assertThat(payload)
                .contains("\"total\" : 25.50")
                .contains("\"note\" : null")
                .contains("\"created_at\" : \"" + createdAt + "\"");
    }

    @Test
    @DisplayName("Should convert nested list values element by element")
    void shouldConvertNestedLists() {
        assertThat(PayloadEncoder.toJsonValue(List.of(1, 'x'))).isEqualTo(List.of(1, "x"));
    }
}
