package com.skanga.sqlbridge.db;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResourceIdentifierTest {

    @Test
    @DisplayName("Should take the table name from the second to last segment")
    void shouldParseTableName() {
        ResourceIdentifier identifier = ResourceIdentifier.parse("postgres://app@localhost:5432/users/schema");

        assertThat(identifier.tableName()).isEqualTo("users");
        assertThat(identifier.suffix()).isEqualTo(ResourceIdentifier.SCHEMA_SUFFIX);
    }

    @Test
    @DisplayName("Should ignore everything before the last two segments")
    void shouldIgnoreLeadingSegments() {
        ResourceIdentifier identifier = ResourceIdentifier.parse("postgres://localhost/a/b/c/orders/schema");

        assertThat(identifier.tableName()).isEqualTo("orders");
    }

    @Test
    @DisplayName("Should decode percent-encoded table names")
    void shouldDecodeTableName() {
        ResourceIdentifier identifier = ResourceIdentifier.parse("postgres://localhost/order%20items/schema");

        assertThat(identifier.tableName()).isEqualTo("order items");
    }

    @Test
    @DisplayName("Should accept identifiers built on an embedded database base")
    void shouldParseEmbeddedBase() {
        ResourceIdentifier identifier = ResourceIdentifier.parse("h2:/USERS/schema");

        assertThat(identifier.tableName()).isEqualTo("USERS");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "postgres://localhost/users/data",
            "postgres://localhost/users/schema/",
            "postgres://localhost/users/SCHEMA",
            "postgres://localhost/schema/users",
            "schema",
            "postgres://local host/users/schema"
    })
    @DisplayName("Should reject identifiers that do not end in /schema")
    void shouldRejectInvalidIdentifiers(String uri) {
        assertThatThrownBy(() -> ResourceIdentifier.parse(uri))
                .isInstanceOf(InvalidResourceIdentifierException.class)
                .hasMessage("Invalid resource identifier");
    }

    @Test
    @DisplayName("Should reject a null identifier")
    void shouldRejectNull() {
        assertThatThrownBy(() -> ResourceIdentifier.parse(null))
                .isInstanceOf(InvalidResourceIdentifierException.class);
    }

    @Test
    @DisplayName("Should keep the offending identifier on the exception")
    void shouldKeepUri() {
        InvalidResourceIdentifierException exception = new InvalidResourceIdentifierException("x://y/z");

        assertThat(exception.getResourceUri()).isEqualTo("x://y/z");
    }
}
