package se.nbis.sda.pipeline.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import se.nbis.sda.pipeline.model.FileRecord;
import se.nbis.sda.pipeline.model.FileStatus;

import java.util.Collection;
import java.util.Optional;

/**
 * Spring Data JPA repository for the {@link FileRecord} entity.
 */
@Repository
public interface FileRecordRepository extends JpaRepository<FileRecord, Long> {

    @Transactional(readOnly = true)
    Optional<FileRecord> findFirstBySubmissionUserAndSubmissionFilePathAndDecryptedFileChecksumAndStatusInOrderByIdDesc(
            String submissionUser, String submissionFilePath, String decryptedFileChecksum,
            Collection<FileStatus> statuses);

    @Transactional(readOnly = true)
    @Query("select f.header from FileRecord f where f.id = :id and f.header is not null")
    Optional<byte[]> findHeaderById(@Param("id") Long id);
}
