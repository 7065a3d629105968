package io.billsync.bitable;

/**
 * A write was not accepted: the transport status was not 200, or the body did not carry code 0.
 * The raw response body is kept because it is the only place per-record rejections show up.
 */
public class InsertException extends BitableException {
    private final int status;
    private final String remoteMessage;
    private final String responseBody;

    public InsertException(String message, String endpoint, int status, String remoteMessage, String responseBody) {
        super(message, endpoint);
        this.status = status;
        this.remoteMessage = remoteMessage;
        this.responseBody = responseBody;
    }

    public InsertException(String message, String endpoint, Throwable cause) {
        super(message, endpoint, cause);
        this.status = -1;
        this.remoteMessage = null;
        this.responseBody = null;
    }

    /** HTTP status, or -1 when no response arrived. */
    public int status() { return status; }

    public String remoteMessage() { return remoteMessage; }

    public String responseBody() { return responseBody; }
}
