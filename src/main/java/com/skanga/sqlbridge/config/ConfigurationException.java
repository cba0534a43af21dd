package com.skanga.sqlbridge.config;

/**
 * Raised when the server cannot be configured from its startup parameters.
 * Always fatal: the process exits before any protocol traffic is served.
 */
public class ConfigurationException extends Exception {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
