package com.skanga.sqlbridge.db;

import com.skanga.sqlbridge.config.ResourceManager;

/**
 * A resource identifier that does not name a table schema. Raised before any database access.
 */
public class InvalidResourceIdentifierException extends IllegalArgumentException {
    private final String resourceUri;

    public InvalidResourceIdentifierException(String resourceUri) {
        super(ResourceManager.getErrorMessage("resource.identifier.invalid"));
        this.resourceUri = resourceUri;
    }

    public String getResourceUri() {
        return resourceUri;
    }
}
