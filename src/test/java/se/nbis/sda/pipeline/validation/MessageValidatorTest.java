package se.nbis.sda.pipeline.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import se.nbis.sda.pipeline.common.json.jackson.JacksonJsonParser;
import se.nbis.sda.pipeline.dto.message.AccessionMessage;
import se.nbis.sda.pipeline.dto.message.AccessionRequest;
import se.nbis.sda.pipeline.dto.message.Checksum;
import se.nbis.sda.pipeline.dto.message.VerificationMessage;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.MessageValidationException;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class MessageValidatorTest {

    private static ValidatorFactory validatorFactory;
    private static MessageValidator validator;

    @BeforeAll
    static void setUp() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
        validator = new MessageValidator(new JacksonJsonParser(new ObjectMapper()), validatorFactory.getValidator());
    }

    @AfterAll
    static void tearDown() {
        validatorFactory.close();
    }

    @Test
    void parse_accessionMessage() {
        AccessionMessage message = validator.parse(bytes("{\"type\":\"accession\",\"user\":\"alice\","
                                                         + "\"filepath\":\"alice/f.txt\",\"accession_id\":\"EGAF001\","
                                                         + "\"decrypted_checksums\":[{\"type\":\"sha256\",\"value\":\"abc123\"}],"
                                                         + "\"extra\":true}"),
                                                   MessageSchema.INGESTION_ACCESSION);

        assertThat(message.getUser()).isEqualTo("alice");
        assertThat(message.getAccessionId()).isEqualTo("EGAF001");
        assertThat(message.getDecryptedSha256()).isEqualTo("abc123");
    }

    @Test
    void parse_verificationMessage() {
        VerificationMessage message = validator.parse(bytes("{\"filepath\":\"alice/f.c4gh\",\"user\":\"alice\","
                                                            + "\"file_id\":7,\"archive_path\":\"a1b2\","
                                                            + "\"encrypted_checksums\":[{\"type\":\"sha256\",\"value\":\"ff\"}],"
                                                            + "\"re_verify\":true}"),
                                                      MessageSchema.INGESTION_VERIFICATION);

        assertThat(message.getFileId()).isEqualTo(7L);
        assertThat(message.isReVerify()).isTrue();
    }

    @Test
    void parse_missingFieldsAreReportedSorted() {
        MessageValidationException e = catchThrowableOfType(
                () -> validator.parse(bytes("{\"type\":\"accession\",\"decrypted_checksums\":[]}"),
                                      MessageSchema.INGESTION_ACCESSION),
                MessageValidationException.class);

        assertThat(e.getPolicy()).isEqualTo(FailurePolicy.REJECT);
        assertThat(e.getSchemaName()).isEqualTo("ingestion-accession");
        assertThat(e.getErrors()).contains("accessionId: The 'accession_id' field is required.",
                                           "filepath: The 'filepath' field is required.",
                                           "user: The 'user' field is required.");
        assertThat(e.getErrors()).isSorted();
    }

    @Test
    void parse_requiresSha256Checksum() {
        assertThatThrownBy(() -> validator.parse(bytes("{\"type\":\"accession\",\"user\":\"alice\","
                                                       + "\"filepath\":\"f\",\"accession_id\":\"EGAF001\","
                                                       + "\"decrypted_checksums\":[{\"type\":\"md5\",\"value\":\"ab\"}]}"),
                                                 MessageSchema.INGESTION_ACCESSION))
                .isInstanceOf(MessageValidationException.class)
                .hasMessageContaining("sha256");
    }

    @Test
    void parse_rejectsMalformedJson() {
        assertThatThrownBy(() -> validator.parse(bytes("{\"user\":"), MessageSchema.INGESTION_ACCESSION))
                .isInstanceOf(MessageValidationException.class)
                .hasMessageContaining("ingestion-accession");
        assertThatThrownBy(() -> validator.parse(new byte[0], MessageSchema.INGESTION_ACCESSION))
                .isInstanceOf(MessageValidationException.class);
    }

    @Test
    void parse_rejectsNullDocument() {
        assertThatThrownBy(() -> validator.parse(bytes("null"), MessageSchema.INGESTION_VERIFICATION))
                .isInstanceOf(MessageValidationException.class)
                .hasMessageContaining("null");
    }

    @Test
    void parse_rejectsWrongFieldType() {
        assertThatThrownBy(() -> validator.parse(bytes("{\"filepath\":\"f\",\"user\":\"u\",\"file_id\":\"seven\","
                                                       + "\"archive_path\":\"a\","
                                                       + "\"encrypted_checksums\":[{\"type\":\"sha256\",\"value\":\"ff\"}]}"),
                                                 MessageSchema.INGESTION_VERIFICATION))
                .isInstanceOf(MessageValidationException.class);
    }

    @Test
    void validate_outboundMessage() {
        AccessionRequest valid = AccessionRequest.builder()
                                                 .user("alice")
                                                 .filepath("alice/f.c4gh")
                                                 .decryptedChecksums(List.of(Checksum.sha256("ab"), Checksum.md5("cd")))
                                                 .build();
        validator.validate(valid, MessageSchema.INGESTION_ACCESSION_REQUEST);

        AccessionRequest invalid = AccessionRequest.builder()
                                                   .user("alice")
                                                   .filepath("alice/f.c4gh")
                                                   .decryptedChecksums(List.of(new Checksum("crc32", "AB")))
                                                   .build();
        assertThatThrownBy(() -> validator.validate(invalid, MessageSchema.INGESTION_ACCESSION_REQUEST))
                .isInstanceOf(MessageValidationException.class)
                .hasMessageContaining("decryptedChecksums[0].type")
                .hasMessageContaining("decryptedChecksums[0].value");
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
