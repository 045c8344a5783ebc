package se.nbis.sda.pipeline.exception;

import lombok.Getter;

import java.io.Serial;

/**
 * Base exception for failures raised while a worker handles a single delivery.
 * The attached {@link FailurePolicy} decides how the delivery is resolved.
 */
@Getter
public class WorkerException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -2466120957734186418L;

    private final FailurePolicy policy;

    public WorkerException(FailurePolicy policy, String message) {
        super(message);
        this.policy = policy;
    }

    public WorkerException(FailurePolicy policy, String message, Throwable cause) {
        super(message, cause);
        this.policy = policy;
    }
}
