package com.skanga.sqlbridge.db;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Lends database connections to one operation at a time.
 * A borrowed connection is owned exclusively by the borrowing operation until it is released.
 */
public interface ConnectionPool extends AutoCloseable {

    /**
     * Borrows a connection, waiting for capacity if every connection is in use.
     *
     * @return a connection owned by the caller until {@link #release(Connection)}
     * @throws SQLException if no connection could be obtained within the pool's timeout
     */
    Connection acquire() throws SQLException;

    /**
     * Returns a borrowed connection. Releasing a connection twice, or one this pool never lent,
     * has no effect.
     *
     * @param connection the borrowed connection
     */
    void release(Connection connection);

    /**
     * @return the number of connections currently lent out
     */
    int outstandingLeases();

    /**
     * Drains the pool. Idempotent.
     */
    @Override
    void close();
}
