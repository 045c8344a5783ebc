package se.nbis.sda.pipeline.validation;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import se.nbis.sda.pipeline.common.json.JsonParser;
import se.nbis.sda.pipeline.exception.MessageValidationException;
import se.nbis.sda.pipeline.exception.json.JsonParsingException;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Binds message documents to their schema type and checks the schema constraints. Nothing in a message is
 * used before it has passed here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MessageValidator {

    private final JsonParser jsonParser;
    private final Validator validator;

    /**
     * Parses and validates an inbound body.
     *
     * @throws MessageValidationException if the body is not JSON, does not bind, or violates a constraint.
     */
    public <T> T parse(byte[] body, MessageSchema<T> schema) {
        T message;
        try {
            message = jsonParser.parseObject(body, schema.getType());
        } catch (JsonParsingException e) {
            throw new MessageValidationException(schema.getName(), e.getMessage(), e);
        }
        if (message == null) {
            throw new MessageValidationException(schema.getName(), List.of("The document is null."));
        }
        validate(message, schema);
        return message;
    }

    /**
     * Checks an already built message, typically an outbound one, against its schema.
     *
     * @throws MessageValidationException if a constraint is violated.
     */
    public <T> void validate(T message, MessageSchema<T> schema) {
        Set<ConstraintViolation<T>> violations = validator.validate(message);
        if (violations.isEmpty()) {
            return;
        }
        List<String> errors = violations.stream()
                                        .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                                        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                                        .collect(Collectors.toList());
        log.debug("Message failed '{}' validation: {}", schema.getName(), errors);
        throw new MessageValidationException(schema.getName(), errors);
    }
}
