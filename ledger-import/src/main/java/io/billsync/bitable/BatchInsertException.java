package io.billsync.bitable;

/** A batch_create call was not accepted. */
public class BatchInsertException extends InsertException {
    public BatchInsertException(String message, String endpoint, int status, String remoteMessage, String responseBody) {
        super(message, endpoint, status, remoteMessage, responseBody);
    }

    public BatchInsertException(String message, String endpoint, Throwable cause) {
        super(message, endpoint, cause);
    }
}
