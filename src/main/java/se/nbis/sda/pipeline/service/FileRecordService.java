package se.nbis.sda.pipeline.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import se.nbis.sda.pipeline.exception.AccessionConflictException;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.FileLookupException;
import se.nbis.sda.pipeline.model.ArchivedFile;
import se.nbis.sda.pipeline.model.FileRecord;
import se.nbis.sda.pipeline.model.FileStatus;
import se.nbis.sda.pipeline.model.VerifiedFile;
import se.nbis.sda.pipeline.repository.FileRecordRepository;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * All reads and state transitions of {@link FileRecord}s made by the workers.
 * <p>
 * Transitions only move a file forward and re-applying one with the values it already recorded is a no-op, so a
 * redelivered message can safely run them again. Transient database failures are retried here; once retries are
 * exhausted the Spring {@code DataAccessException} reaches the worker, which requeues the message.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FileRecordService {

    private static final Set<FileStatus> VERIFIED_STATUSES = EnumSet.of(FileStatus.COMPLETED, FileStatus.READY);

    private final FileRecordRepository fileRecordRepository;

    /**
     * Finds where a verified file was archived, by submission user, submission path and decrypted sha256.
     * The most recent match wins.
     */
    @Transactional(readOnly = true)
    @Retryable(label = "getArchived", retryFor = TransientDataAccessException.class,
               maxAttemptsExpression = "#{${sda.database.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${sda.database.retry.delay-ms}}"),
               listeners = {"databaseRetryListener"})
    public Optional<ArchivedFile> getArchived(String user, String filepath, String decryptedSha256) {
        return findVerified(user, filepath, decryptedSha256)
                .filter(file -> file.getArchiveFilePath() != null && file.getArchiveFileSize() != null)
                .map(file -> new ArchivedFile(file.getArchiveFilePath(), file.getArchiveFileSize()));
    }

    @Transactional(readOnly = true)
    @Retryable(label = "getHeader", retryFor = TransientDataAccessException.class,
               maxAttemptsExpression = "#{${sda.database.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${sda.database.retry.delay-ms}}"),
               listeners = {"databaseRetryListener"})
    public Optional<byte[]> getHeader(Long fileId) {
        return fileRecordRepository.findHeaderById(fileId);
    }

    @Transactional(readOnly = true)
    @Retryable(label = "findById", retryFor = TransientDataAccessException.class,
               maxAttemptsExpression = "#{${sda.database.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${sda.database.retry.delay-ms}}"),
               listeners = {"databaseRetryListener"})
    public Optional<FileRecord> findById(Long fileId) {
        return fileRecordRepository.findById(fileId);
    }

    /**
     * Records the outcome of a verification and moves the file to {@link FileStatus#COMPLETED}.
     * A file that is already {@link FileStatus#READY} keeps its status and its recorded values.
     *
     * @throws FileLookupException if no file has this id.
     */
    @Transactional
    @Retryable(label = "markCompleted", retryFor = TransientDataAccessException.class,
               maxAttemptsExpression = "#{${sda.database.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${sda.database.retry.delay-ms}}"),
               listeners = {"databaseRetryListener"})
    public void markCompleted(Long fileId, VerifiedFile verified) {
        FileRecord file = fileRecordRepository.findById(fileId).orElseThrow(
                () -> new FileLookupException(FailurePolicy.REJECT, "No file with id " + fileId));

        if (file.getStatus().isAfter(FileStatus.COMPLETED)) {
            log.info("File {} is already {}, not moving it back to {}.", fileId, file.getStatus(),
                     FileStatus.COMPLETED);
            return;
        }
        if (file.getStatus() == FileStatus.COMPLETED && matches(file, verified)) {
            log.debug("File {} is already completed with the same checksums.", fileId);
            return;
        }
        if (file.getStatus() == FileStatus.COMPLETED) {
            log.warn("File {} was completed before with different values, overwriting them.", fileId);
        }
        file.setArchiveFileSize(verified.archiveSize());
        file.setArchiveFileChecksum(verified.archiveChecksum());
        file.setDecryptedFileSize(verified.decryptedSize());
        file.setDecryptedFileChecksum(verified.decryptedChecksum());
        file.setStatus(FileStatus.COMPLETED);
        fileRecordRepository.save(file);
        log.info("File {} marked as {}.", fileId, FileStatus.COMPLETED);
    }

    /**
     * Assigns the accession id and moves the file to {@link FileStatus#READY}.
     *
     * @throws FileLookupException        if no verified file matches, which may be a record still in flight.
     * @throws AccessionConflictException if the file already has a different accession id.
     */
    @Transactional
    @Retryable(label = "markReady", retryFor = TransientDataAccessException.class,
               maxAttemptsExpression = "#{${sda.database.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${sda.database.retry.delay-ms}}"),
               listeners = {"databaseRetryListener"})
    public void markReady(String accessionId, String user, String filepath, String decryptedSha256) {
        FileRecord file = findVerified(user, filepath, decryptedSha256).orElseThrow(
                () -> new FileLookupException(FailurePolicy.REQUEUE, "No verified file '" + filepath + "' of user '"
                                                                     + user + "' with checksum " + decryptedSha256));

        if (file.getStableId() != null && !file.getStableId().equals(accessionId)) {
            throw new AccessionConflictException("File " + file.getId() + " already has accession id '"
                                                 + file.getStableId() + "', refusing '" + accessionId + "'");
        }
        if (file.getStatus() == FileStatus.READY && accessionId.equals(file.getStableId())) {
            log.debug("File {} is already ready with accession id {}.", file.getId(), accessionId);
            return;
        }
        file.setStableId(accessionId);
        file.setStatus(FileStatus.READY);
        fileRecordRepository.save(file);
        log.info("File {} marked as {} with accession id {}.", file.getId(), FileStatus.READY, accessionId);
    }

    private Optional<FileRecord> findVerified(String user, String filepath, String decryptedSha256) {
        return fileRecordRepository
                .findFirstBySubmissionUserAndSubmissionFilePathAndDecryptedFileChecksumAndStatusInOrderByIdDesc(
                        user, filepath, decryptedSha256, VERIFIED_STATUSES);
    }

    private static boolean matches(FileRecord file, VerifiedFile verified) {
        return Objects.equals(file.getArchiveFileSize(), verified.archiveSize())
               && Objects.equals(file.getArchiveFileChecksum(), verified.archiveChecksum())
               && Objects.equals(file.getDecryptedFileSize(), verified.decryptedSize())
               && Objects.equals(file.getDecryptedFileChecksum(), verified.decryptedChecksum());
    }
}
