package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * The broker did not confirm an outbound message. The inbound delivery must not be acknowledged.
 */
public class PublishException extends WorkerException {
    @Serial
    private static final long serialVersionUID = -3987519350786427011L;

    public PublishException(String message, Throwable cause) {
        super(FailurePolicy.REQUEUE, message, cause);
    }
}
