package io.billsync.ledger;

/** Neither decoding policy could produce text from a ledger file. */
public class LedgerDecodeException extends RuntimeException {
    public LedgerDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
