package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * Thrown when state that should already exist for a file (its archive location, its stored header)
 * cannot be found. Whether the message is requeued is decided by the worker raising it.
 */
public class FileLookupException extends WorkerException {
    @Serial
    private static final long serialVersionUID = -1960837153287716604L;

    public FileLookupException(FailurePolicy policy, String message) {
        super(policy, message);
    }
}
