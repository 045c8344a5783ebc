package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * The stored header or the archived ciphertext could not be decrypted with the process key.
 * Redelivery cannot change the outcome, so the message is dropped.
 */
public class DecryptException extends WorkerException {
    @Serial
    private static final long serialVersionUID = -7419934473050208837L;

    public DecryptException(String message, Throwable cause) {
        super(FailurePolicy.REJECT, message, cause);
    }
}
