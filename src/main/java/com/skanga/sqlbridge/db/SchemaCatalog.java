package com.skanga.sqlbridge.db;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lists tables as resources and reads a single table's column schema.
 * Each call borrows one connection from the pool and returns it before completing.
 */
public class SchemaCatalog {
    private static final Logger logger = LoggerFactory.getLogger(SchemaCatalog.class);

    static final String LIST_TABLES_SQL =
            "SELECT table_name FROM information_schema.tables WHERE table_schema = ?";
    static final String LIST_COLUMNS_SQL =
            "SELECT column_name, data_type FROM information_schema.columns WHERE table_name = ?";

    private final ConnectionPool connectionPool;
    private final URI resourceBase;

    /**
     * @param connectionPool Pool to borrow connections from
     * @param resourceBase Base that {@code <table>/schema} is resolved against; must not carry credentials
     */
    public SchemaCatalog(ConnectionPool connectionPool, URI resourceBase) {
        this.connectionPool = connectionPool;
        this.resourceBase = resourceBase;
    }

    /**
     * Lists one resource per table in the connection's default schema, in the engine's order.
     *
     * @return the table resources
     * @throws SQLException if the metadata query fails
     */
    public List<TableResource> listResources() throws SQLException {
        List<TableResource> tableResources = new ArrayList<>();

        Connection dbConn = connectionPool.acquire();
        try (PreparedStatement prepStmt = dbConn.prepareStatement(LIST_TABLES_SQL)) {
            prepStmt.setString(1, dbConn.getSchema());
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                while (resultSet.next()) {
                    String tableName = resultSet.getString(1);
                    tableResources.add(TableResource.forTable(resourceUri(tableName), tableName));
                }
            }
        } finally {
            connectionPool.release(dbConn);
        }

        logger.debug("Listed {} table resources", tableResources.size());
        return tableResources;
    }

    /**
     * Reads the columns of the table named by a resource URI.
     * The identifier is validated before a connection is borrowed. A table that does not exist
     * yields an empty list.
     *
     * @param uri Resource URI ending in {@code /<table>/schema}
     * @return the table's columns in the engine's order
     * @throws InvalidResourceIdentifierException if the URI does not end in {@code /schema}
     * @throws SQLException if the metadata query fails
     */
    public List<ColumnInfo> readResource(String uri) throws SQLException {
        ResourceIdentifier resourceIdentifier = ResourceIdentifier.parse(uri);
        List<ColumnInfo> tableColumns = new ArrayList<>();

        Connection dbConn = connectionPool.acquire();
        try (PreparedStatement prepStmt = dbConn.prepareStatement(LIST_COLUMNS_SQL)) {
            prepStmt.setString(1, resourceIdentifier.tableName());
            try (ResultSet resultSet = prepStmt.executeQuery()) {
                while (resultSet.next()) {
                    tableColumns.add(new ColumnInfo(resultSet.getString(1), resultSet.getString(2)));
                }
            }
        } finally {
            connectionPool.release(dbConn);
        }

        return tableColumns;
    }

    String resourceUri(String tableName) {
        try {
            // "./" keeps a table name containing ':' from being read as a scheme
            URI relativeUri = new URI(null, null, "./" + tableName + "/" + ResourceIdentifier.SCHEMA_SUFFIX, null);
            return resourceBase.resolve(relativeUri).toString();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Cannot build resource URI for table: " + tableName, e);
        }
    }
}
