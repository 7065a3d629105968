package io.billsync.importer;

/** Required configuration is missing or malformed. Raised before any remote call is made. */
public class ConfigException extends RuntimeException {
    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
