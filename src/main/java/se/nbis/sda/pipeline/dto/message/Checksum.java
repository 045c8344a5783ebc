package se.nbis.sda.pipeline.dto.message;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Optional;

/**
 * A checksum as carried in pipeline messages: the algorithm name and the lowercase hex digest.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Checksum {

    public static final String SHA256 = "sha256";
    public static final String MD5 = "md5";

    @NotBlank(message = "The checksum 'type' is required.")
    @Pattern(regexp = "sha256|md5", message = "The checksum 'type' must be one of sha256, md5.")
    private String type;

    @NotBlank(message = "The checksum 'value' is required.")
    @Pattern(regexp = "[0-9a-f]+", message = "The checksum 'value' must be a lowercase hex digest.")
    private String value;

    public static Checksum sha256(String value) {
        return new Checksum(SHA256, value);
    }

    public static Checksum md5(String value) {
        return new Checksum(MD5, value);
    }

    /**
     * Returns the value of the first checksum of the given algorithm. Later entries for the same algorithm are
     * ignored.
     */
    public static Optional<String> find(List<Checksum> checksums, String type) {
        if (checksums == null) {
            return Optional.empty();
        }
        return checksums.stream()
                        .filter(c -> c != null && type.equals(c.getType()))
                        .map(Checksum::getValue)
                        .findFirst();
    }
}
