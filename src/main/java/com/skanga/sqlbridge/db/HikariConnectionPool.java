package com.skanga.sqlbridge.db;

import com.skanga.sqlbridge.config.ConfigParams;
import com.skanga.sqlbridge.config.ConnectionAddress;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link ConnectionPool} backed by HikariCP. Thread-safe; tracks which connections are lent out
 * so that release is idempotent and the outstanding lease count can be observed.
 */
public class HikariConnectionPool implements ConnectionPool {
    private static final Logger logger = LoggerFactory.getLogger(HikariConnectionPool.class);

    private final HikariDataSource dataSource;
    private final Set<Connection> leasedConnections = ConcurrentHashMap.newKeySet();

    /**
     * Creates the pool and verifies that a connection can be opened.
     *
     * @param configParams Server configuration
     * @throws IllegalStateException if the database cannot be reached
     */
    public HikariConnectionPool(ConfigParams configParams) {
        ConnectionAddress databaseAddress = configParams.databaseAddress();

        HikariConfig poolConfig = new HikariConfig();
        poolConfig.setPoolName("sqlbridge-pool");
        poolConfig.setJdbcUrl(databaseAddress.jdbcUrl());
        poolConfig.setUsername(databaseAddress.userName());
        poolConfig.setPassword(databaseAddress.password());
        poolConfig.setMaximumPoolSize(configParams.maxConnections());
        poolConfig.setConnectionTimeout(configParams.connectionTimeoutMs());
        poolConfig.setIdleTimeout(configParams.idleTimeoutMs());
        poolConfig.setMaxLifetime(configParams.maxLifetimeMs());
        poolConfig.setLeakDetectionThreshold(configParams.leakDetectionThresholdMs());

        try {
            this.dataSource = new HikariDataSource(poolConfig);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize connection pool: {}", databaseAddress, e);
            throw new IllegalStateException("Database connection pool initialization failed", e);
        }
        logger.info("Database connection pool initialized for: {}", databaseAddress);
    }

    /**
     * Wraps an existing data source. Useful for testing or when the pool is managed elsewhere.
     *
     * @param dataSource Pre-configured HikariDataSource
     */
    public HikariConnectionPool(HikariDataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public Connection acquire() throws SQLException {
        Connection connection = dataSource.getConnection();
        leasedConnections.add(connection);
        logger.debug("Connection acquired, {} outstanding", leasedConnections.size());
        return connection;
    }

    @Override
    public void release(Connection connection) {
        if (connection == null || !leasedConnections.remove(connection)) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            // Hikari evicts a connection it cannot reset, the lease is over either way
            logger.warn("Error returning connection to pool: {}", e.getMessage(), e);
        }
        logger.debug("Connection released, {} outstanding", leasedConnections.size());
    }

    @Override
    public int outstandingLeases() {
        return leasedConnections.size();
    }

    @Override
    public void close() {
        if (dataSource != null && !dataSource.isClosed()) {
            try {
                dataSource.close();
                logger.info("Database connection pool closed");
            } catch (Exception e) {
                logger.warn("Error closing database connection pool: {}", e.getMessage(), e);
            }
        }
    }
}
