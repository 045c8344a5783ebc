package se.nbis.sda.pipeline.worker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.nbis.sda.pipeline.broker.MessageBroker;
import se.nbis.sda.pipeline.common.json.JsonSerializer;
import se.nbis.sda.pipeline.config.PipelineProperties;
import se.nbis.sda.pipeline.crypto.VerificationPipeline;
import se.nbis.sda.pipeline.crypto.VerificationResult;
import se.nbis.sda.pipeline.dto.message.AccessionRequest;
import se.nbis.sda.pipeline.dto.message.Checksum;
import se.nbis.sda.pipeline.dto.message.VerificationMessage;
import se.nbis.sda.pipeline.exception.ChecksumMismatchException;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.FileLookupException;
import se.nbis.sda.pipeline.exception.StorageAccessException;
import se.nbis.sda.pipeline.exception.WorkerException;
import se.nbis.sda.pipeline.model.FileRecord;
import se.nbis.sda.pipeline.model.VerifiedFile;
import se.nbis.sda.pipeline.service.FileRecordService;
import se.nbis.sda.pipeline.storage.InvalidStoragePathException;
import se.nbis.sda.pipeline.storage.StorageBackend;
import se.nbis.sda.pipeline.validation.MessageSchema;
import se.nbis.sda.pipeline.validation.MessageValidator;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Decrypts an archived file with the stored header, records its sizes and checksums, and asks for an accession
 * id. With {@code re_verify} set it only checks the file against what was recorded earlier.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "sda.worker", havingValue = "verify")
public class VerifyWorker extends WorkerLoop<VerificationMessage, VerifyWorker.Outcome, AccessionRequest> {

    /**
     * What a verification established, plus the plaintext md5 that is published but not stored.
     */
    record Outcome(VerifiedFile file, String decryptedMd5) {
    }

    private final FileRecordService fileRecordService;
    private final StorageBackend archive;
    private final VerificationPipeline verificationPipeline;

    public VerifyWorker(MessageBroker broker, MessageValidator validator, JsonSerializer jsonSerializer,
                        PipelineProperties properties, FileRecordService fileRecordService,
                        @Qualifier("archiveStorage") StorageBackend archive,
                        VerificationPipeline verificationPipeline) {
        super(broker, validator, jsonSerializer, properties.getBroker());
        this.fileRecordService = fileRecordService;
        this.archive = archive;
        this.verificationPipeline = verificationPipeline;
    }

    @Override
    protected MessageSchema<VerificationMessage> inboundSchema() {
        return MessageSchema.INGESTION_VERIFICATION;
    }

    @Override
    protected MessageSchema<AccessionRequest> outboundSchema() {
        return MessageSchema.INGESTION_ACCESSION_REQUEST;
    }

    @Override
    protected Outcome process(VerificationMessage message) {
        byte[] header = fileRecordService.getHeader(message.getFileId()).orElseThrow(
                () -> new FileLookupException(FailurePolicy.REJECT, "No stored header for file id "
                                                                    + message.getFileId()));

        String archivePath = message.getArchivePath();
        VerificationResult result;
        long archiveSize;
        try {
            archiveSize = archive.size(archivePath);
            InputStream body = archive.openReader(archivePath);
            result = verificationPipeline.verify(header, body);
        } catch (InvalidStoragePathException e) {
            throw new WorkerException(FailurePolicy.REJECT, e.getMessage(), e);
        } catch (IOException e) {
            throw new StorageAccessException("Failed to read archived file '" + archivePath + "': "
                                             + e.getMessage(), e);
        }
        if (result.archiveBytesRead() != archiveSize) {
            throw new StorageAccessException("Read " + result.archiveBytesRead() + " bytes of '" + archivePath
                                             + "' but storage reports " + archiveSize);
        }
        log.info("Verified '{}': {} archived bytes, {} decrypted bytes.", archivePath, archiveSize,
                 result.decryptedSize());

        VerifiedFile verified = new VerifiedFile(archiveSize, result.archiveSha256(), result.decryptedSize(),
                                                 result.decryptedSha256());
        if (message.isReVerify()) {
            compareWithRecord(message.getFileId(), verified);
        }
        return new Outcome(verified, result.decryptedMd5());
    }

    private void compareWithRecord(Long fileId, VerifiedFile verified) {
        FileRecord recorded = fileRecordService.findById(fileId).orElseThrow(
                () -> new FileLookupException(FailurePolicy.REJECT, "No file with id " + fileId));
        if (!Objects.equals(recorded.getArchiveFileChecksum(), verified.archiveChecksum())
            || !Objects.equals(recorded.getDecryptedFileChecksum(), verified.decryptedChecksum())
            || !Objects.equals(recorded.getDecryptedFileSize(), verified.decryptedSize())) {
            throw new ChecksumMismatchException("Re-verification of file " + fileId + " does not match the record:"
                                                + " archive sha256 " + verified.archiveChecksum()
                                                + ", decrypted sha256 " + verified.decryptedChecksum()
                                                + ", decrypted size " + verified.decryptedSize());
        }
        log.info("Re-verification of file {} matches the recorded checksums.", fileId);
    }

    @Override
    protected Optional<AccessionRequest> buildCompletion(VerificationMessage message, Outcome result) {
        if (message.isReVerify()) {
            return Optional.empty();
        }
        return Optional.of(AccessionRequest.builder()
                                           .user(message.getUser())
                                           .filepath(message.getFilepath())
                                           .decryptedChecksums(List.of(
                                                   Checksum.sha256(result.file().decryptedChecksum()),
                                                   Checksum.md5(result.decryptedMd5())))
                                           .build());
    }

    @Override
    protected void persist(VerificationMessage message, Outcome result) {
        fileRecordService.markCompleted(message.getFileId(), result.file());
    }

    @Override
    protected String describe(VerificationMessage message) {
        return "user=" + message.getUser() + ", filepath=" + message.getFilepath() + ", file_id="
               + message.getFileId();
    }
}
