package se.nbis.sda.pipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;

@Entity
@Table(name = "files")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FileRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String submissionUser;

    @Column(nullable = false)
    private String submissionFilePath;

    private String archiveFilePath;

    private Long archiveFileSize;

    /** sha256 of the archived bytes as stored, header excluded. */
    private String archiveFileChecksum;

    private Long decryptedFileSize;

    private String decryptedFileChecksum;

    /** Crypt4GH header split off at ingestion; the archive holds only the data segments. */
    @ToString.Exclude
    @Column(length = 8192)
    private byte[] header;

    /** Accession id, assigned once. */
    private String stableId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private FileStatus status;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
