package se.nbis.sda.pipeline.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.nbis.sda.pipeline.broker.MessageBroker;
import se.nbis.sda.pipeline.common.json.jackson.JacksonJsonParser;
import se.nbis.sda.pipeline.common.json.jackson.JacksonJsonSerializer;
import se.nbis.sda.pipeline.config.PipelineProperties;
import se.nbis.sda.pipeline.crypto.Crypt4Gh;
import se.nbis.sda.pipeline.crypto.Crypt4GhTestSupport;
import se.nbis.sda.pipeline.crypto.VerificationPipeline;
import se.nbis.sda.pipeline.model.FileRecord;
import se.nbis.sda.pipeline.model.FileStatus;
import se.nbis.sda.pipeline.model.VerifiedFile;
import se.nbis.sda.pipeline.service.FileRecordService;
import se.nbis.sda.pipeline.storage.StorageBackend;
import se.nbis.sda.pipeline.validation.MessageValidator;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class VerifyWorkerTest {

    private static final long FILE_ID = 7L;
    private static final String ARCHIVE_PATH = "3f2a9c1e";

    private static ValidatorFactory validatorFactory;

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Mock
    private MessageBroker broker;
    @Mock
    private FileRecordService fileRecordService;
    @Mock
    private StorageBackend archive;

    private byte[] readerKey;
    private byte[] plaintext;
    private byte[] header;
    private byte[] body;
    private VerifyWorker worker;

    @BeforeAll
    static void setUpValidation() {
        validatorFactory = Validation.buildDefaultValidatorFactory();
    }

    @AfterAll
    static void tearDownValidation() {
        validatorFactory.close();
    }

    @BeforeEach
    void setUp() {
        readerKey = Crypt4GhTestSupport.newSecretKey();
        byte[] dataKey = Crypt4GhTestSupport.randomBytes(Crypt4Gh.KEY_SIZE);
        plaintext = Crypt4GhTestSupport.randomBytes(Crypt4Gh.SEGMENT_SIZE + 4_000);
        header = Crypt4GhTestSupport.header(Crypt4GhTestSupport.newSecretKey(), Crypt4Gh.publicKey(readerKey),
                                            dataKey, null);
        body = Crypt4GhTestSupport.body(dataKey, plaintext);

        PipelineProperties properties = new PipelineProperties();
        properties.getBroker().setQueue("archived");
        properties.getBroker().setRoutingKey("verified");
        MessageValidator validator = new MessageValidator(new JacksonJsonParser(objectMapper),
                                                          validatorFactory.getValidator());
        worker = new VerifyWorker(broker, validator, new JacksonJsonSerializer(objectMapper), properties,
                                  fileRecordService, archive, new VerificationPipeline(readerKey));
    }

    @Test
    void handle_verifiesMarksCompletedAndRequestsAccession() throws Exception {
        stubArchive(body.length);
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(false));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.ACKNOWLEDGED);

        assertThat(delivery.calls()).containsExactly("ack");
        verify(fileRecordService).markCompleted(FILE_ID, new VerifiedFile(body.length, DigestUtils.sha256Hex(body),
                                                                          plaintext.length,
                                                                          DigestUtils.sha256Hex(plaintext)));
        ArgumentCaptor<byte[]> published = ArgumentCaptor.forClass(byte[].class);
        verify(broker).publish(eq("corr-1"), eq(""), eq("verified"), eq(true), published.capture());
        JsonNode request = objectMapper.readTree(published.getValue());
        assertThat(request.get("user").asText()).isEqualTo("alice");
        assertThat(request.get("filepath").asText()).isEqualTo("alice/f.c4gh");
        JsonNode checksums = request.get("decrypted_checksums");
        assertThat(checksums.get(0).get("type").asText()).isEqualTo("sha256");
        assertThat(checksums.get(0).get("value").asText()).isEqualTo(DigestUtils.sha256Hex(plaintext));
        assertThat(checksums.get(1).get("type").asText()).isEqualTo("md5");
        assertThat(checksums.get(1).get("value").asText()).isEqualTo(DigestUtils.md5Hex(plaintext));
    }

    @Test
    void handle_reVerifyMatchingRecordOnlyAcks() throws Exception {
        stubArchive(body.length);
        when(fileRecordService.findById(FILE_ID)).thenReturn(Optional.of(record(DigestUtils.sha256Hex(body))));
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(true));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.ACKNOWLEDGED);

        assertThat(delivery.calls()).containsExactly("ack");
        verify(fileRecordService, never()).markCompleted(any(), any());
        verifyNoInteractions(broker);
    }

    @Test
    void handle_reVerifyMismatchIsRejected() throws Exception {
        stubArchive(body.length);
        when(fileRecordService.findById(FILE_ID)).thenReturn(Optional.of(record("00ff")));
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(true));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.REJECTED);

        assertThat(delivery.calls()).containsExactly("nack:false");
        verify(broker).publish(eq("corr-1"), eq(""), eq("error"), eq(true), any(byte[].class));
        verify(fileRecordService, never()).markCompleted(any(), any());
    }

    @Test
    void handle_missingHeaderIsRejected() {
        when(fileRecordService.getHeader(FILE_ID)).thenReturn(Optional.empty());
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(false));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.REJECTED);

        assertThat(delivery.calls()).containsExactly("nack:false");
        verifyNoInteractions(archive);
        verify(broker, never()).publish(anyString(), anyString(), eq("verified"), anyBoolean(), any(byte[].class));
    }

    @Test
    void handle_headerForAnotherKeyIsRejected() throws Exception {
        byte[] foreignHeader = Crypt4GhTestSupport.header(Crypt4GhTestSupport.newSecretKey(),
                                                          Crypt4Gh.publicKey(Crypt4GhTestSupport.newSecretKey()),
                                                          Crypt4GhTestSupport.randomBytes(Crypt4Gh.KEY_SIZE), null);
        when(fileRecordService.getHeader(FILE_ID)).thenReturn(Optional.of(foreignHeader));
        when(archive.size(ARCHIVE_PATH)).thenReturn((long) body.length);
        when(archive.openReader(ARCHIVE_PATH)).thenReturn(new ByteArrayInputStream(body));
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(false));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.REJECTED);
        assertThat(delivery.calls()).containsExactly("nack:false");
    }

    @Test
    void handle_missingArchivedFileIsRequeued() throws Exception {
        when(fileRecordService.getHeader(FILE_ID)).thenReturn(Optional.of(header));
        when(archive.size(ARCHIVE_PATH)).thenThrow(new NoSuchFileException(ARCHIVE_PATH));
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(false));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.REQUEUED);
        assertThat(delivery.calls()).containsExactly("nack:true");
        verifyNoInteractions(broker);
    }

    @Test
    void handle_sizeDisagreementIsRequeued() throws Exception {
        stubArchive(body.length + 1L);
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(false));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.REQUEUED);

        assertThat(delivery.calls()).containsExactly("nack:true");
        verify(fileRecordService, never()).markCompleted(any(), any());
    }

    @Test
    void handle_nonPositiveFileIdIsRejected() {
        RecordingDelivery delivery = new RecordingDelivery("corr-1", message(false).replace("\"file_id\":7",
                                                                                            "\"file_id\":0"));

        assertThat(worker.handle(delivery)).isEqualTo(DeliveryState.REJECTED);
        verifyNoInteractions(fileRecordService, archive);
    }

    private void stubArchive(long reportedSize) throws IOException {
        when(fileRecordService.getHeader(FILE_ID)).thenReturn(Optional.of(header));
        when(archive.size(ARCHIVE_PATH)).thenReturn(reportedSize);
        when(archive.openReader(ARCHIVE_PATH)).thenReturn(new ByteArrayInputStream(body));
    }

    private FileRecord record(String archiveChecksum) {
        return FileRecord.builder()
                         .id(FILE_ID)
                         .submissionUser("alice")
                         .submissionFilePath("alice/f.c4gh")
                         .archiveFilePath(ARCHIVE_PATH)
                         .archiveFileSize((long) body.length)
                         .archiveFileChecksum(archiveChecksum)
                         .decryptedFileSize((long) plaintext.length)
                         .decryptedFileChecksum(DigestUtils.sha256Hex(plaintext))
                         .status(FileStatus.COMPLETED)
                         .build();
    }

    private String message(boolean reVerify) {
        return "{\"filepath\":\"alice/f.c4gh\",\"user\":\"alice\",\"file_id\":7,\"archive_path\":\"" + ARCHIVE_PATH
               + "\",\"encrypted_checksums\":[{\"type\":\"sha256\",\"value\":\"" + DigestUtils.sha256Hex(body)
               + "\"}],\"re_verify\":" + reVerify + "}";
    }
}
