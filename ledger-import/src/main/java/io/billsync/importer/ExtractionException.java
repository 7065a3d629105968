package io.billsync.importer;

/** The input file is missing, unreadable, or holds no CSV ledger. */
public class ExtractionException extends RuntimeException {
    public ExtractionException(String message) {
        super(message);
    }

    public ExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
