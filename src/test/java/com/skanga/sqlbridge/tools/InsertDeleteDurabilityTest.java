package com.skanga.sqlbridge.tools;

import com.skanga.sqlbridge.TestUtils;
import com.skanga.sqlbridge.db.HikariConnectionPool;
import com.skanga.sqlbridge.db.TransactionLifecycle;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * insert and delete run read-write but never commit, so the cleanup rollback discards their work
 * even though they report success. If either tool starts committing these tests fail on purpose.
 */
class InsertDeleteDurabilityTest {
    private String jdbcUrl;
    private HikariConnectionPool connectionPool;
    private ToolDispatcher toolDispatcher;

    @BeforeEach
    void setUp() throws SQLException {
        jdbcUrl = TestUtils.uniqueH2Url();
        TestUtils.setupShopDatabase(jdbcUrl);
        connectionPool = TestUtils.createPool(jdbcUrl);
        toolDispatcher = new ToolDispatcher(new TransactionLifecycle(connectionPool));
    }

    @AfterEach
    void tearDown() {
        connectionPool.close();
    }

    @Test
    @DisplayName("insert reports success but the row is rolled back")
    void insertIsNotDurable() throws SQLException {
        ToolResult toolResult = toolDispatcher.callTool(
                new ToolInvocation("insert", "INSERT INTO customers VALUES (3, 'New User', 'new@example.com')"));

        assertThat(toolResult.isError()).isFalse();
        assertThat(toolResult.text()).isEqualTo("Data inserted successfully");
        assertThat(TestUtils.countRows(jdbcUrl, "SELECT COUNT(*) FROM customers WHERE id = 3")).isZero();
        assertThat(connectionPool.outstandingLeases()).isZero();
    }

    @Test
    @DisplayName("delete reports success but the row survives")
    void deleteIsNotDurable() throws SQLException {
        ToolResult toolResult = toolDispatcher.callTool(new ToolInvocation("delete", "DELETE FROM customers WHERE id = 1"));

        assertThat(toolResult.isError()).isFalse();
        assertThat(toolResult.text()).isEqualTo("Data deleted successfully");
        assertThat(TestUtils.countRows(jdbcUrl, "SELECT COUNT(*) FROM customers WHERE id = 1")).isEqualTo(1);
    }

    @Test
    @DisplayName("update commits, unlike insert and delete")
    void updateIsDurable() throws SQLException {
        ToolResult toolResult = toolDispatcher.callTool(
                new ToolInvocation("update", "UPDATE customers SET email = 'jd@example.com' WHERE id = 1"));

        assertThat(toolResult.isError()).isFalse();
        assertThat(TestUtils.countRows(jdbcUrl, "SELECT COUNT(*) FROM customers WHERE email = 'jd@example.com'")).isEqualTo(1);
    }
}
