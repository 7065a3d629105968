package io.billsync.bitable;

/** Sheet listing failed, or the spreadsheet has no sheet to default to. */
public class SheetResolutionException extends BitableException {
    public SheetResolutionException(String message, String endpoint) {
        super(message, endpoint);
    }

    public SheetResolutionException(String message, String endpoint, Throwable cause) {
        super(message, endpoint, cause);
    }
}
