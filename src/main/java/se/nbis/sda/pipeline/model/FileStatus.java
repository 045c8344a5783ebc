package se.nbis.sda.pipeline.model;

/**
 * Lifecycle of an ingested file. States only move forward, in declaration order.
 */
public enum FileStatus {
    /**
     * The upload has been registered but nothing has been written to the archive yet.
     */
    REGISTERED,
    /**
     * The encrypted body is in the archive and its header is stored.
     */
    ARCHIVED,
    /**
     * The archived file has been decrypted and its checksums recorded.
     */
    COMPLETED,
    /**
     * An accession id has been assigned and the backup copy exists.
     */
    READY;

    /**
     * @return {@code true} if moving from this status to {@code target} would go backwards.
     */
    public boolean isAfter(FileStatus target) {
        return this.ordinal() > target.ordinal();
    }
}
