package se.nbis.sda.pipeline.dto.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Diagnostic event published on the error channel for a message that was dropped.
 * The original body is kept verbatim so an operator can replay it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ErrorMessage {

    @JsonProperty("correlation_id")
    private String correlationId;

    private String reason;

    @JsonProperty("original_message")
    private String originalMessage;
}
