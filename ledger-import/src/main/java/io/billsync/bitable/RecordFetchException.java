package io.billsync.bitable;

/**
 * A page of a record search failed. Pages fetched before it are discarded.
 */
public class RecordFetchException extends BitableException {
    private final int page;

    public RecordFetchException(String message, String endpoint, int page) {
        super(message, endpoint);
        this.page = page;
    }

    public RecordFetchException(String message, String endpoint, int page, Throwable cause) {
        super(message, endpoint, cause);
        this.page = page;
    }

    /** 1-based index of the failing page. */
    public int page() { return page; }
}
