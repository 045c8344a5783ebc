package se.nbis.sda.pipeline.crypto;

import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import se.nbis.sda.pipeline.exception.DecryptException;
import se.nbis.sda.pipeline.exception.FailurePolicy;
import se.nbis.sda.pipeline.exception.StorageAccessException;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.SequenceInputStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VerificationPipelineTest {

    private byte[] readerKey;
    private byte[] writerKey;
    private byte[] dataKey;
    private VerificationPipeline pipeline;

    @BeforeEach
    void setUp() {
        readerKey = Crypt4GhTestSupport.newSecretKey();
        writerKey = Crypt4GhTestSupport.newSecretKey();
        dataKey = Crypt4GhTestSupport.randomBytes(Crypt4Gh.KEY_SIZE);
        pipeline = new VerificationPipeline(readerKey);
    }

    @Test
    void verify_reportsSizesAndChecksums() {
        byte[] plaintext = Crypt4GhTestSupport.randomBytes(3 * Crypt4Gh.SEGMENT_SIZE + 17);
        byte[] header = header(null);
        byte[] body = Crypt4GhTestSupport.body(dataKey, plaintext);

        VerificationResult result = pipeline.verify(header, new ByteArrayInputStream(body));

        assertThat(result.decryptedSize()).isEqualTo(plaintext.length);
        assertThat(result.decryptedSha256()).isEqualTo(DigestUtils.sha256Hex(plaintext));
        assertThat(result.decryptedMd5()).isEqualTo(DigestUtils.md5Hex(plaintext));
        assertThat(result.archiveSha256()).isEqualTo(DigestUtils.sha256Hex(body));
        assertThat(result.archiveBytesRead()).isEqualTo(body.length);
    }

    @Test
    void verify_hashesWholeArchiveWhenEditListEndsEarly() {
        byte[] plaintext = Crypt4GhTestSupport.randomBytes(2 * Crypt4Gh.SEGMENT_SIZE);
        byte[] body = Crypt4GhTestSupport.body(dataKey, plaintext);

        VerificationResult result = pipeline.verify(header(new long[]{0, 100}), new ByteArrayInputStream(body));

        assertThat(result.decryptedSize()).isEqualTo(100);
        assertThat(result.archiveSha256()).isEqualTo(DigestUtils.sha256Hex(body));
        assertThat(result.archiveBytesRead()).isEqualTo(body.length);
    }

    @Test
    void verify_wrongKeyIsADecryptFailure() {
        VerificationPipeline otherPipeline = new VerificationPipeline(Crypt4GhTestSupport.newSecretKey());
        byte[] body = Crypt4GhTestSupport.body(dataKey, new byte[64]);

        assertThatThrownBy(() -> otherPipeline.verify(header(null), new ByteArrayInputStream(body)))
                .isInstanceOf(DecryptException.class)
                .extracting("policy").isEqualTo(FailurePolicy.REJECT);
    }

    @Test
    void verify_readFailureIsAStorageFailure() {
        byte[] body = Crypt4GhTestSupport.body(dataKey, Crypt4GhTestSupport.randomBytes(2 * Crypt4Gh.SEGMENT_SIZE));
        InputStream failing = new SequenceInputStream(new ByteArrayInputStream(body, 0, 1000), new InputStream() {
            @Override
            public int read() throws IOException {
                throw new IOException("connection reset");
            }
        });

        assertThatThrownBy(() -> pipeline.verify(header(null), failing))
                .isInstanceOf(StorageAccessException.class)
                .hasMessageContaining("connection reset")
                .extracting("policy").isEqualTo(FailurePolicy.REQUEUE);
    }

    private byte[] header(long[] editList) {
        return Crypt4GhTestSupport.header(writerKey, Crypt4Gh.publicKey(readerKey), dataKey, editList);
    }
}
