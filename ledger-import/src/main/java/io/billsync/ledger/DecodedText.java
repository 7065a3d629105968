package io.billsync.ledger;

import java.io.IOException;
import java.nio.charset.Charset;

/**
 * Outcome of decoding a ledger file. The branch says which decoding policy produced the text.
 */
public record DecodedText(Branch branch, String text, Charset charset, IOException failure) {

    public enum Branch {
        /** Legacy encoding decoded every byte. */
        STRICT,
        /** Legacy decoding failed; UTF-8 with invalid sequences dropped. */
        LOSSY,
        /** The bytes could not be read at all. */
        FAILED
    }

    static DecodedText strict(String text, Charset charset) {
        return new DecodedText(Branch.STRICT, text, charset, null);
    }

    static DecodedText lossy(String text, Charset charset) {
        return new DecodedText(Branch.LOSSY, text, charset, null);
    }

    static DecodedText failed(IOException failure) {
        return new DecodedText(Branch.FAILED, null, null, failure);
    }
}
