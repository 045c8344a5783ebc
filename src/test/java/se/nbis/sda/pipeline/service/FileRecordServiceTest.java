package se.nbis.sda.pipeline.service;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import se.nbis.sda.pipeline.exception.AccessionConflictException;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.FileLookupException;
import se.nbis.sda.pipeline.model.ArchivedFile;
import se.nbis.sda.pipeline.model.FileRecord;
import se.nbis.sda.pipeline.model.FileStatus;
import se.nbis.sda.pipeline.model.VerifiedFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@Import({FileRecordService.class, DatabaseRetryListener.class})
class FileRecordServiceTest {

    private static final VerifiedFile VERIFIED = new VerifiedFile(1024, "aa11", 900, "abc123");

    @Autowired
    private FileRecordService fileRecordService;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    void getHeader_returnsStoredHeader() {
        FileRecord file = persist(FileStatus.ARCHIVED, null);

        assertThat(fileRecordService.getHeader(file.getId())).hasValueSatisfying(
                header -> assertThat(header).containsExactly(1, 2, 3));
        assertThat(fileRecordService.getHeader(file.getId() + 100)).isEmpty();
    }

    @Test
    void markCompleted_recordsVerificationOutcome() {
        FileRecord file = persist(FileStatus.ARCHIVED, null);

        fileRecordService.markCompleted(file.getId(), VERIFIED);

        FileRecord stored = reload(file);
        assertThat(stored.getStatus()).isEqualTo(FileStatus.COMPLETED);
        assertThat(stored.getArchiveFileSize()).isEqualTo(1024L);
        assertThat(stored.getArchiveFileChecksum()).isEqualTo("aa11");
        assertThat(stored.getDecryptedFileSize()).isEqualTo(900L);
        assertThat(stored.getDecryptedFileChecksum()).isEqualTo("abc123");
    }

    @Test
    void markCompleted_isIdempotent() {
        FileRecord file = persist(FileStatus.ARCHIVED, null);

        fileRecordService.markCompleted(file.getId(), VERIFIED);
        fileRecordService.markCompleted(file.getId(), VERIFIED);

        FileRecord stored = reload(file);
        assertThat(stored.getStatus()).isEqualTo(FileStatus.COMPLETED);
        assertThat(stored.getDecryptedFileChecksum()).isEqualTo("abc123");
    }

    @Test
    void markCompleted_neverMovesReadyFileBack() {
        FileRecord file = persist(FileStatus.READY, "EGAF001");
        file.setDecryptedFileChecksum("abc123");
        entityManager.flush();

        fileRecordService.markCompleted(file.getId(), new VerifiedFile(1, "ff", 2, "ee"));

        FileRecord stored = reload(file);
        assertThat(stored.getStatus()).isEqualTo(FileStatus.READY);
        assertThat(stored.getDecryptedFileChecksum()).isEqualTo("abc123");
        assertThat(stored.getStableId()).isEqualTo("EGAF001");
    }

    @Test
    void markCompleted_unknownFileIsRejected() {
        assertThatThrownBy(() -> fileRecordService.markCompleted(404L, VERIFIED))
                .isInstanceOf(FileLookupException.class)
                .extracting("policy").isEqualTo(FailurePolicy.REJECT);
    }

    @Test
    void getArchived_findsVerifiedFilesOnly() {
        persist(FileStatus.ARCHIVED, null);
        assertThat(fileRecordService.getArchived("alice", "alice/f.txt", "abc123")).isEmpty();

        FileRecord completed = persist(FileStatus.ARCHIVED, null);
        fileRecordService.markCompleted(completed.getId(), VERIFIED);

        assertThat(fileRecordService.getArchived("alice", "alice/f.txt", "abc123"))
                .contains(new ArchivedFile("alice/f.txt.c4gh", 1024));
        assertThat(fileRecordService.getArchived("bob", "alice/f.txt", "abc123")).isEmpty();
        assertThat(fileRecordService.getArchived("alice", "alice/f.txt", "other")).isEmpty();
    }

    @Test
    void markReady_assignsAccessionId() {
        FileRecord file = completedFile();

        fileRecordService.markReady("EGAF001", "alice", "alice/f.txt", "abc123");

        FileRecord stored = reload(file);
        assertThat(stored.getStatus()).isEqualTo(FileStatus.READY);
        assertThat(stored.getStableId()).isEqualTo("EGAF001");
    }

    @Test
    void markReady_isIdempotent() {
        FileRecord file = completedFile();

        fileRecordService.markReady("EGAF001", "alice", "alice/f.txt", "abc123");
        fileRecordService.markReady("EGAF001", "alice", "alice/f.txt", "abc123");

        assertThat(reload(file).getStableId()).isEqualTo("EGAF001");
    }

    @Test
    void markReady_refusesSecondAccessionId() {
        FileRecord file = completedFile();
        fileRecordService.markReady("EGAF001", "alice", "alice/f.txt", "abc123");

        assertThatThrownBy(() -> fileRecordService.markReady("EGAF002", "alice", "alice/f.txt", "abc123"))
                .isInstanceOf(AccessionConflictException.class)
                .hasMessageContaining("EGAF001");
        assertThat(reload(file).getStableId()).isEqualTo("EGAF001");
    }

    @Test
    void markReady_unverifiedFileIsRequeued() {
        persist(FileStatus.ARCHIVED, null);

        assertThatThrownBy(() -> fileRecordService.markReady("EGAF001", "alice", "alice/f.txt", "abc123"))
                .isInstanceOf(FileLookupException.class)
                .extracting("policy").isEqualTo(FailurePolicy.REQUEUE);
    }

    private FileRecord completedFile() {
        FileRecord file = persist(FileStatus.ARCHIVED, null);
        fileRecordService.markCompleted(file.getId(), VERIFIED);
        return file;
    }

    private FileRecord persist(FileStatus status, String stableId) {
        FileRecord file = FileRecord.builder()
                                    .submissionUser("alice")
                                    .submissionFilePath("alice/f.txt")
                                    .archiveFilePath("alice/f.txt.c4gh")
                                    .header(new byte[]{1, 2, 3})
                                    .stableId(stableId)
                                    .status(status)
                                    .build();
        return entityManager.persistFlushFind(file);
    }

    private FileRecord reload(FileRecord file) {
        entityManager.flush();
        entityManager.clear();
        return entityManager.find(FileRecord.class, file.getId());
    }
}
