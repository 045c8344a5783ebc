package se.nbis.sda.pipeline.exception;

import lombok.Getter;

import java.io.Serial;
import java.util.List;

/**
 * Thrown when a message body does not satisfy the contract of its schema.
 * Such a message is permanently malformed and is never requeued.
 */
@Getter
public class MessageValidationException extends WorkerException {
    @Serial
    private static final long serialVersionUID = 6104513325830512719L;

    private final String schemaName;
    private final List<String> errors;

    public MessageValidationException(String schemaName, List<String> errors) {
        super(FailurePolicy.REJECT, "Message does not validate against schema '" + schemaName + "': " + errors);
        this.schemaName = schemaName;
        this.errors = List.copyOf(errors);
    }

    public MessageValidationException(String schemaName, String error, Throwable cause) {
        super(FailurePolicy.REJECT, "Message does not validate against schema '" + schemaName + "': " + error, cause);
        this.schemaName = schemaName;
        this.errors = List.of(error);
    }
}
