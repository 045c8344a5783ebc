package se.nbis.sda.pipeline.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.InvalidCipherTextException;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;

/**
 * Decrypts a Crypt4GH stream (header followed by data segments) on the fly.
 * <p>
 * The header is read when the stream is created. Every segment is authenticated before any of its bytes are
 * returned, and an edit list in the header, if present, is applied to the plaintext. Once the edit list has
 * no more bytes to keep the stream reports end of file without reading further segments.
 */
@Slf4j
public class Crypt4GhInputStream extends InputStream {

    private static final long UNBOUNDED = -1L;

    private final InputStream in;
    private final List<byte[]> dataKeys;
    private final long[] editList;

    private byte[] segment = new byte[0];
    private int position;
    private long segmentIndex;
    private boolean endOfData;

    private int editIndex;
    private long skip;
    private long keep = UNBOUNDED;
    private boolean editListExhausted;

    public Crypt4GhInputStream(InputStream in, byte[] readerSecretKey) throws IOException {
        this.in = in;
        Crypt4GhHeader header = Crypt4GhHeader.read(in, readerSecretKey);
        this.dataKeys = header.getDataKeys();
        this.editList = header.getEditList();
        if (editList != null) {
            nextEdit();
        }
    }

    @Override
    public int read() throws IOException {
        byte[] single = new byte[1];
        int n = read(single, 0, 1);
        return n == -1 ? -1 : single[0] & 0xff;
    }

    @Override
    public int read(byte[] buffer, int offset, int length) throws IOException {
        if (length == 0) {
            return 0;
        }
        while (true) {
            if (editListExhausted) {
                return -1;
            }
            if (position == segment.length && !nextSegment()) {
                return -1;
            }
            int available = segment.length - position;
            if (skip > 0) {
                int skipped = (int) Math.min(skip, available);
                position += skipped;
                skip -= skipped;
                continue;
            }
            int n = Math.min(length, available);
            if (keep != UNBOUNDED) {
                n = (int) Math.min(n, keep);
            }
            System.arraycopy(segment, position, buffer, offset, n);
            position += n;
            if (keep != UNBOUNDED) {
                keep -= n;
                if (keep == 0) {
                    nextEdit();
                }
            }
            return n;
        }
    }

    @Override
    public int available() {
        if (editListExhausted || skip > 0) {
            return 0;
        }
        int buffered = segment.length - position;
        return keep == UNBOUNDED ? buffered : (int) Math.min(buffered, keep);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    /**
     * Loads the next skip and keep lengths. An odd length list keeps everything after its last skip; an even
     * one ends the plaintext after its last keep. Skips separated by an empty keep add up.
     */
    private void nextEdit() {
        skip = 0;
        do {
            if (editIndex >= editList.length) {
                editListExhausted = true;
                return;
            }
            skip += editList[editIndex++];
            keep = editIndex < editList.length ? editList[editIndex++] : UNBOUNDED;
        } while (keep == 0);
    }

    private boolean nextSegment() throws IOException {
        if (endOfData) {
            return false;
        }
        byte[] cipherSegment = in.readNBytes(Crypt4Gh.CIPHER_SEGMENT_SIZE);
        if (cipherSegment.length == 0) {
            endOfData = true;
            return false;
        }
        if (cipherSegment.length <= Crypt4Gh.NONCE_SIZE + Crypt4Gh.MAC_SIZE) {
            throw new Crypt4GhException("Truncated data segment " + segmentIndex + " ("
                                        + cipherSegment.length + " bytes)");
        }
        if (cipherSegment.length < Crypt4Gh.CIPHER_SEGMENT_SIZE) {
            endOfData = true;
        }
        segment = decrypt(cipherSegment);
        position = 0;
        segmentIndex++;
        return true;
    }

    private byte[] decrypt(byte[] cipherSegment) throws Crypt4GhException {
        byte[] nonce = Arrays.copyOf(cipherSegment, Crypt4Gh.NONCE_SIZE);
        int length = cipherSegment.length - Crypt4Gh.NONCE_SIZE;
        for (byte[] key : dataKeys) {
            try {
                return Crypt4Gh.open(key, nonce, cipherSegment, Crypt4Gh.NONCE_SIZE, length);
            } catch (InvalidCipherTextException e) {
                log.trace("Data key did not open segment {}, trying the next one.", segmentIndex);
            }
        }
        throw new Crypt4GhException("Data segment " + segmentIndex + " failed authentication with every data key");
    }
}
