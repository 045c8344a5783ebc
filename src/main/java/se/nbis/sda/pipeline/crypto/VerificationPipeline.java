package se.nbis.sda.pipeline.crypto;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.ObservableInputStream;
import org.apache.commons.io.output.NullOutputStream;
import se.nbis.sda.pipeline.exception.DecryptException;
import se.nbis.sda.pipeline.exception.StorageAccessException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;

/**
 * Decrypts an archived file and computes all of its checksums in a single streaming pass.
 * <p>
 * The stored header is put back in front of the archived body, the encrypted bytes are hashed as they are read,
 * and the plaintext is hashed with sha256 and md5 on its way to a discarding sink. Memory use does not depend on
 * the file size.
 */
@Slf4j
public class VerificationPipeline {

    private final byte[] privateKey;

    public VerificationPipeline(byte[] privateKey) {
        this.privateKey = privateKey.clone();
    }

    /**
     * Runs the pipeline and closes {@code archiveBody}.
     *
     * @throws DecryptException       if the header or any segment cannot be decrypted.
     * @throws StorageAccessException if reading the archived body fails.
     */
    public VerificationResult verify(byte[] header, InputStream archiveBody) {
        ChecksumObserver archiveSha256 = ChecksumObserver.sha256();
        ChecksumObserver plainSha256 = ChecksumObserver.sha256();
        ChecksumObserver plainMd5 = ChecksumObserver.md5();

        try (InputStream observedArchive = new ObservableInputStream(archiveBody, archiveSha256);
             InputStream logical = new SequenceInputStream(new ByteArrayInputStream(header), observedArchive);
             InputStream plaintext = new ObservableInputStream(new Crypt4GhInputStream(logical, privateKey),
                                                               plainSha256, plainMd5)) {
            long decryptedSize = IOUtils.copyLarge(plaintext, NullOutputStream.INSTANCE);
            // An edit list may end the plaintext early; the archive checksum still covers the whole body.
            IOUtils.consume(observedArchive);

            VerificationResult result = new VerificationResult(archiveSha256.getCount(), decryptedSize,
                                                               archiveSha256.hex(), plainSha256.hex(),
                                                               plainMd5.hex());
            log.debug("Verified {} archived bytes into {} plaintext bytes.", result.archiveBytesRead(),
                      decryptedSize);
            return result;
        } catch (Crypt4GhException e) {
            throw new DecryptException("Failed to decrypt archived file: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new StorageAccessException("Failed to read archived file: " + e.getMessage(), e);
        }
    }
}
