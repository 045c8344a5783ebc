package se.nbis.sda.pipeline.crypto;

import java.io.IOException;
import java.io.Serial;

/**
 * Crypt4GH data that cannot be decrypted: a malformed header or key file, no packet readable with our key,
 * a failed authentication tag or a truncated segment.
 * <p>
 * It is an {@link IOException} so it can travel through stream reads, but unlike other I/O failures it is
 * permanent for the data at hand.
 */
public class Crypt4GhException extends IOException {
    @Serial
    private static final long serialVersionUID = -5160372640718931207L;

    public Crypt4GhException(String message) {
        super(message);
    }

    public Crypt4GhException(String message, Throwable cause) {
        super(message, cause);
    }
}
