package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * The file already carries a different accession id than the one in the message.
 */
public class AccessionConflictException extends WorkerException {
    @Serial
    private static final long serialVersionUID = 3391570821846274735L;

    public AccessionConflictException(String message) {
        super(FailurePolicy.REJECT, message);
    }
}
