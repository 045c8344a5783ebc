package se.nbis.sda.pipeline.model;

/**
 * The facts established by decrypting an archived file, as written by mark-completed.
 */
public record VerifiedFile(long archiveSize, String archiveChecksum, long decryptedSize, String decryptedChecksum) {
}
