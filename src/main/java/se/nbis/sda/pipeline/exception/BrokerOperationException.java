package se.nbis.sda.pipeline.exception;

import java.io.Serial;

/**
 * Acknowledging or returning a delivery to the broker failed.
 */
public class BrokerOperationException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 8046624116153358920L;

    public BrokerOperationException(String message, Throwable cause) {
        super(message, cause);
    }
}
