package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * A storage backend read or write failed, or the number of bytes moved did not match what was expected.
 * The message is requeued and retried after the backend recovers.
 */
public class StorageAccessException extends WorkerException {
    @Serial
    private static final long serialVersionUID = 2817042455716350391L;

    public StorageAccessException(String message) {
        super(FailurePolicy.REQUEUE, message);
    }

    public StorageAccessException(String message, Throwable cause) {
        super(FailurePolicy.REQUEUE, message, cause);
    }
}
