package se.nbis.sda.pipeline.crypto;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.input.ObservableInputStream;

import java.security.MessageDigest;

/**
 * Feeds every byte read through an {@link ObservableInputStream} into a message digest and counts them.
 * Several observers can watch the same stream, so any number of checksums come out of one pass.
 */
public class ChecksumObserver extends ObservableInputStream.Observer {

    private final MessageDigest digest;
    private long count;
    private String hex;

    public ChecksumObserver(MessageDigest digest) {
        this.digest = digest;
    }

    public static ChecksumObserver sha256() {
        return new ChecksumObserver(DigestUtils.getSha256Digest());
    }

    public static ChecksumObserver md5() {
        return new ChecksumObserver(DigestUtils.getMd5Digest());
    }

    @Override
    public void data(int value) {
        digest.update((byte) value);
        count++;
    }

    @Override
    public void data(byte[] buffer, int offset, int length) {
        digest.update(buffer, offset, length);
        count += length;
    }

    public long getCount() {
        return count;
    }

    /**
     * Finishes the digest on first call. Bytes observed afterwards are not reflected in the value.
     */
    public String hex() {
        if (hex == null) {
            hex = Hex.encodeHexString(digest.digest());
        }
        return hex;
    }
}
