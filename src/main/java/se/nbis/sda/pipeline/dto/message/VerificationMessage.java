package se.nbis.sda.pipeline.dto.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound verify work: an ingested file has been written to the archive and must be decrypted and checksummed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationMessage {

    @NotBlank(message = "The 'filepath' field is required.")
    private String filepath;

    @NotBlank(message = "The 'user' field is required.")
    private String user;

    @NotNull(message = "The 'file_id' field is required.")
    @Positive(message = "The 'file_id' must be a positive number.")
    @JsonProperty("file_id")
    private Long fileId;

    @NotBlank(message = "The 'archive_path' field is required.")
    @JsonProperty("archive_path")
    private String archivePath;

    @Valid
    @NotEmpty(message = "The 'encrypted_checksums' list cannot be empty.")
    @JsonProperty("encrypted_checksums")
    private List<Checksum> encryptedChecksums;

    @JsonProperty("re_verify")
    private boolean reVerify;
}
