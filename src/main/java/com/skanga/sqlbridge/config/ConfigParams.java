package com.skanga.sqlbridge.config;

/**
 * Server configuration holder: the database address plus the connection pool tuning knobs.
 * Immutable, validated on construction.
 *
 * @param databaseAddress The parsed database connection address (required)
 * @param maxConnections Maximum number of connections in the pool (must be positive)
 * @param connectionTimeoutMs How long {@code acquire} may wait for a free connection
 * @param idleTimeoutMs Timeout in milliseconds before idle connections are closed
 * @param maxLifetimeMs Maximum lifetime in milliseconds for connections in the pool
 * @param leakDetectionThresholdMs Threshold in milliseconds for reporting leaked connections (0 disables)
 */
public record ConfigParams(
        ConnectionAddress databaseAddress,
        int maxConnections,
        int connectionTimeoutMs,
        int idleTimeoutMs,
        int maxLifetimeMs,
        int leakDetectionThresholdMs
) {
    public ConfigParams {
        if (databaseAddress == null) {
            throw new IllegalArgumentException("Database address cannot be null");
        }
        if (maxConnections <= 0) {
            throw new IllegalArgumentException("Max connections must be positive");
        }
        if (connectionTimeoutMs <= 0) {
            throw new IllegalArgumentException("Connection timeout must be positive");
        }
        if (idleTimeoutMs < 0) {
            throw new IllegalArgumentException("Idle timeout cannot be negative");
        }
        if (maxLifetimeMs < 0) {
            throw new IllegalArgumentException("Max lifetime cannot be negative");
        }
        if (leakDetectionThresholdMs < 0) {
            throw new IllegalArgumentException("Leak detection threshold cannot be negative");
        }
    }

    /**
     * Creates a configuration with the default pool settings.
     *
     * @param databaseAddress The parsed database connection address
     * @return A ConfigParams instance with default settings
     */
    public static ConfigParams defaultConfig(ConnectionAddress databaseAddress) {
        return new ConfigParams(
                databaseAddress,
                10,      // maxConnections
                30000,   // connectionTimeoutMs
                600000,  // idleTimeoutMs (10 minutes)
                1800000, // maxLifetimeMs (30 minutes)
                60000    // leakDetectionThresholdMs (1 minute)
        );
    }

    @Override
    public String toString() {
        return String.format("ConfigParams{address=%s, maxConnections=%d, connectionTimeoutMs=%d}",
                databaseAddress, maxConnections, connectionTimeoutMs);
    }
}
