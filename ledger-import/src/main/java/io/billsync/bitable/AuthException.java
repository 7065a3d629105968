package io.billsync.bitable;

/** The tenant access token exchange was rejected or could not be performed. */
public class AuthException extends BitableException {
    public AuthException(String message, String endpoint) {
        super(message, endpoint);
    }

    public AuthException(String message, String endpoint, Throwable cause) {
        super(message, endpoint, cause);
    }
}
