package se.nbis.sda.pipeline.crypto;

/**
 * Everything learned from one pass over an archived file.
 *
 * @param archiveBytesRead  number of encrypted body bytes read from storage
 * @param decryptedSize     number of plaintext bytes after the edit list, if any, was applied
 * @param archiveSha256     hex sha256 of the archived body as read
 * @param decryptedSha256   hex sha256 of the plaintext
 * @param decryptedMd5      hex md5 of the plaintext
 */
public record VerificationResult(long archiveBytesRead, long decryptedSize, String archiveSha256,
                                 String decryptedSha256, String decryptedMd5) {
}
