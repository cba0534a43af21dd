package com.skanga.sqlbridge.db;

import java.net.URI;
import java.net.URISyntaxException;

/**
 * Parsed form of a table resource URI: the last two path segments.
 *
 * @param tableName The table the resource points at (not checked for existence)
 * @param suffix Always {@value #SCHEMA_SUFFIX}
 */
public record ResourceIdentifier(String tableName, String suffix) {
    public static final String SCHEMA_SUFFIX = "schema";

    /**
     * Splits a resource URI into table name and suffix.
     *
     * @param uri the identifier presented for reading
     * @return the parsed identifier
     * @throws InvalidResourceIdentifierException if the URI is unparseable or does not end in {@code /schema}
     */
    public static ResourceIdentifier parse(String uri) {
        if (uri == null) {
            throw new InvalidResourceIdentifierException(null);
        }

        String resourcePath;
        try {
            URI parsedUri = new URI(uri);
            resourcePath = parsedUri.isOpaque() ? parsedUri.getSchemeSpecificPart() : parsedUri.getPath();
        } catch (URISyntaxException e) {
            throw new InvalidResourceIdentifierException(uri);
        }
        if (resourcePath == null) {
            throw new InvalidResourceIdentifierException(uri);
        }

        // limit -1 keeps trailing empty segments, so ".../users/schema/" is rejected
        String[] pathSegments = resourcePath.split("/", -1);
        if (pathSegments.length < 2 || !SCHEMA_SUFFIX.equals(pathSegments[pathSegments.length - 1])) {
            throw new InvalidResourceIdentifierException(uri);
        }
        return new ResourceIdentifier(pathSegments[pathSegments.length - 2], SCHEMA_SUFFIX);
    }
}
