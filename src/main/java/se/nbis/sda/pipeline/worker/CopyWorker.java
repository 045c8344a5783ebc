package se.nbis.sda.pipeline.worker;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import se.nbis.sda.pipeline.broker.MessageBroker;
import se.nbis.sda.pipeline.common.json.JsonSerializer;
import se.nbis.sda.pipeline.config.PipelineProperties;
import se.nbis.sda.pipeline.dto.message.AccessionMessage;
import se.nbis.sda.pipeline.dto.message.CompletionMessage;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.FileLookupException;
import se.nbis.sda.pipeline.exception.StorageAccessException;
import se.nbis.sda.pipeline.exception.WorkerException;
import se.nbis.sda.pipeline.model.ArchivedFile;
import se.nbis.sda.pipeline.service.FileRecordService;
import se.nbis.sda.pipeline.storage.Abortable;
import se.nbis.sda.pipeline.storage.InvalidStoragePathException;
import se.nbis.sda.pipeline.storage.StorageBackend;
import se.nbis.sda.pipeline.validation.MessageSchema;
import se.nbis.sda.pipeline.validation.MessageValidator;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * Copies a file that received an accession id from the archive to the backup storage and marks it ready.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "sda.worker", havingValue = "copy")
public class CopyWorker extends WorkerLoop<AccessionMessage, ArchivedFile, CompletionMessage> {

    private final FileRecordService fileRecordService;
    private final StorageBackend archive;
    private final StorageBackend backup;

    public CopyWorker(MessageBroker broker, MessageValidator validator, JsonSerializer jsonSerializer,
                      PipelineProperties properties, FileRecordService fileRecordService,
                      @Qualifier("archiveStorage") StorageBackend archive,
                      @Qualifier("backupStorage") StorageBackend backup) {
        super(broker, validator, jsonSerializer, properties.getBroker());
        this.fileRecordService = fileRecordService;
        this.archive = archive;
        this.backup = backup;
    }

    @Override
    protected MessageSchema<AccessionMessage> inboundSchema() {
        return MessageSchema.INGESTION_ACCESSION;
    }

    @Override
    protected MessageSchema<CompletionMessage> outboundSchema() {
        return MessageSchema.INGESTION_COMPLETION;
    }

    /**
     * A missing archive record is requeued: the verify stage may not have committed it yet.
     */
    @Override
    protected ArchivedFile process(AccessionMessage message) {
        ArchivedFile archived = fileRecordService
                .getArchived(message.getUser(), message.getFilepath(), message.getDecryptedSha256())
                .orElseThrow(() -> new FileLookupException(FailurePolicy.REQUEUE,
                                                           "No archived file found for '" + message.getFilepath()
                                                           + "' of user '" + message.getUser() + "'"));

        copy(archived.archivePath(), archived.archiveSize());
        log.info("Copied '{}' ({} bytes) to backup storage.", archived.archivePath(), archived.archiveSize());
        return archived;
    }

    /**
     * Streams the archived file into the backup. The backup writer is only closed, and so committed, when the
     * byte count matches the archive record. On any other outcome it is aborted.
     */
    private void copy(String archivePath, long expectedSize) {
        OutputStream out = null;
        try (InputStream in = archive.openReader(archivePath)) {
            out = backup.openWriter(archivePath);
            long copied = IOUtils.copyLarge(in, out);
            if (copied != expectedSize) {
                StorageAccessException mismatch = new StorageAccessException(
                        "Copied " + copied + " bytes of '" + archivePath + "' but the archive records "
                        + expectedSize);
                discard(out, mismatch);
                throw mismatch;
            }
            out.close();
        } catch (InvalidStoragePathException e) {
            discard(out, e);
            throw new WorkerException(FailurePolicy.REJECT, e.getMessage(), e);
        } catch (IOException e) {
            discard(out, e);
            throw new StorageAccessException("Failed to copy '" + archivePath + "' to backup storage: "
                                             + e.getMessage(), e);
        }
    }

    private static void discard(OutputStream out, Exception cause) {
        if (out == null) {
            return;
        }
        try {
            if (out instanceof Abortable) {
                ((Abortable) out).abort();
            } else {
                out.close();
            }
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }

    @Override
    protected Optional<CompletionMessage> buildCompletion(AccessionMessage message, ArchivedFile result) {
        return Optional.of(CompletionMessage.builder()
                                            .user(message.getUser())
                                            .filepath(message.getFilepath())
                                            .accessionId(message.getAccessionId())
                                            .decryptedChecksums(message.getDecryptedChecksums())
                                            .build());
    }

    @Override
    protected void persist(AccessionMessage message, ArchivedFile result) {
        fileRecordService.markReady(message.getAccessionId(), message.getUser(), message.getFilepath(),
                                    message.getDecryptedSha256());
    }

    @Override
    protected String describe(AccessionMessage message) {
        return "user=" + message.getUser() + ", filepath=" + message.getFilepath() + ", accession_id="
               + message.getAccessionId();
    }
}
