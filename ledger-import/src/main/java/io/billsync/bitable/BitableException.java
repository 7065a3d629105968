package io.billsync.bitable;

/**
 * Base of every failure reported by {@link BitableClient}. Carries the API path that failed.
 */
public class BitableException extends RuntimeException {
    private final String endpoint;

    public BitableException(String message, String endpoint) {
        super(message);
        this.endpoint = endpoint;
    }

    public BitableException(String message, String endpoint, Throwable cause) {
        super(message, cause);
        this.endpoint = endpoint;
    }

    public String endpoint() { return endpoint; }
}
