package se.nbis.sda.pipeline.dto.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outbound message of the verify worker, asking the next stage to assign an accession id to the verified file.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessionRequest {

    @NotBlank(message = "The 'user' field is required.")
    private String user;

    @NotBlank(message = "The 'filepath' field is required.")
    private String filepath;

    @Valid
    @NotEmpty(message = "The 'decrypted_checksums' list cannot be empty.")
    @JsonProperty("decrypted_checksums")
    private List<Checksum> decryptedChecksums;
}
