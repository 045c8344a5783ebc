package se.nbis.sda.pipeline.dto.message;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound copy work: an accession id has been assigned to an archived file, which now has to be synced to the
 * backup storage.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessionMessage {

    @NotBlank(message = "The 'type' field is required.")
    private String type;

    @NotBlank(message = "The 'user' field is required.")
    private String user;

    @NotBlank(message = "The 'filepath' field is required.")
    private String filepath;

    @NotBlank(message = "The 'accession_id' field is required.")
    @JsonProperty("accession_id")
    private String accessionId;

    @Valid
    @NotEmpty(message = "The 'decrypted_checksums' list cannot be empty.")
    @JsonProperty("decrypted_checksums")
    private List<Checksum> decryptedChecksums;

    @JsonIgnore
    @AssertTrue(message = "A sha256 entry is required in 'decrypted_checksums'.")
    public boolean isSha256Present() {
        return Checksum.find(decryptedChecksums, Checksum.SHA256).isPresent();
    }

    @JsonIgnore
    public String getDecryptedSha256() {
        return Checksum.find(decryptedChecksums, Checksum.SHA256).orElse(null);
    }
}
