package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * A re-verification produced checksums that differ from the ones recorded for the file.
 */
public class ChecksumMismatchException extends WorkerException {
    @Serial
    private static final long serialVersionUID = 5530195766139411170L;

    public ChecksumMismatchException(String message) {
        super(FailurePolicy.REJECT, message);
    }
}
