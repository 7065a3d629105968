package io.billsync.ledger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Decodes ledger bytes: the provider's legacy national encoding first (strict), then UTF-8 with
 * invalid sequences dropped.
 */
public class LedgerDecoder {
    private static final Logger log = LoggerFactory.getLogger(LedgerDecoder.class);

    public static final Charset LEGACY = Charset.forName("GBK");

    private final Charset legacy;

    public LedgerDecoder() { this(LEGACY); }

    public LedgerDecoder(Charset legacy) {
        this.legacy = legacy;
    }

    public DecodedText decode(InputStream in) {
        byte[] bytes;
        try {
            bytes = in.readAllBytes();
        } catch (IOException e) {
            return DecodedText.failed(e);
        }
        return decode(bytes);
    }

    public DecodedText decode(byte[] bytes) {
        try {
            String text = legacy.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return DecodedText.strict(text, legacy);
        } catch (CharacterCodingException e) {
            log.debug("{} decoding failed ({}), retrying as UTF-8 dropping invalid bytes", legacy.name(), e.toString());
        }
        try {
            String text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.IGNORE)
                    .onUnmappableCharacter(CodingErrorAction.IGNORE)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return DecodedText.lossy(text, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            // unreachable: IGNORE never reports
            throw new IllegalStateException("UTF-8 decoding with ignored errors failed", e);
        }
    }
}
