package se.nbis.sda.pipeline.validation;

import se.nbis.sda.pipeline.dto.message.AccessionMessage;
import se.nbis.sda.pipeline.dto.message.AccessionRequest;
import se.nbis.sda.pipeline.dto.message.CompletionMessage;
import se.nbis.sda.pipeline.dto.message.VerificationMessage;

/**
 * A named message contract and the type its documents bind to. The constraints live on the type as Bean
 * Validation annotations.
 *
 * @param <T> the message type
 */
public final class MessageSchema<T> {

    public static final MessageSchema<AccessionMessage> INGESTION_ACCESSION =
            new MessageSchema<>("ingestion-accession", AccessionMessage.class);
    public static final MessageSchema<VerificationMessage> INGESTION_VERIFICATION =
            new MessageSchema<>("ingestion-verification", VerificationMessage.class);
    public static final MessageSchema<AccessionRequest> INGESTION_ACCESSION_REQUEST =
            new MessageSchema<>("ingestion-accession-request", AccessionRequest.class);
    public static final MessageSchema<CompletionMessage> INGESTION_COMPLETION =
            new MessageSchema<>("ingestion-completion", CompletionMessage.class);

    private final String name;
    private final Class<T> type;

    private MessageSchema(String name, Class<T> type) {
        this.name = name;
        this.type = type;
    }

    public String getName() {
        return name;
    }

    public Class<T> getType() {
        return type;
    }

    @Override
    public String toString() {
        return name;
    }
}
