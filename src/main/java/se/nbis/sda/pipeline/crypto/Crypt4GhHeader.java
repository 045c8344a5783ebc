package se.nbis.sda.pipeline.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.InvalidCipherTextException;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The decrypted content of a Crypt4GH header: the data keys addressed to us and the optional edit list.
 * Packets sealed for other readers are skipped.
 */
@Slf4j
public final class Crypt4GhHeader {

    private static final int MAX_PACKETS = 64;
    private static final int MAX_PACKET_LENGTH = 1 << 20;
    private static final int PACKET_PREFIX = 4 + 4;
    private static final int MIN_PACKET_LENGTH = PACKET_PREFIX + Crypt4Gh.KEY_SIZE + Crypt4Gh.NONCE_SIZE
                                                 + Crypt4Gh.MAC_SIZE;

    private final List<byte[]> dataKeys;
    private final long[] editList;

    private Crypt4GhHeader(List<byte[]> dataKeys, long[] editList) {
        this.dataKeys = dataKeys;
        this.editList = editList;
    }

    public List<byte[]> getDataKeys() {
        return dataKeys;
    }

    /**
     * @return the edit list lengths, alternating skip and keep, or {@code null} when the header has none.
     */
    public long[] getEditList() {
        return editList;
    }

    /**
     * Reads and decrypts a header from the start of {@code in}, leaving the stream positioned at the first
     * data segment.
     */
    public static Crypt4GhHeader read(InputStream in, byte[] readerSecretKey) throws IOException {
        byte[] magic = readFully(in, Crypt4Gh.MAGIC.length, "magic");
        if (!Arrays.equals(magic, Crypt4Gh.MAGIC)) {
            throw new Crypt4GhException("Not a Crypt4GH header: bad magic bytes");
        }
        ByteBuffer preamble = ByteBuffer.wrap(readFully(in, 8, "version")).order(ByteOrder.LITTLE_ENDIAN);
        int version = preamble.getInt();
        if (version != Crypt4Gh.VERSION) {
            throw new Crypt4GhException("Unsupported Crypt4GH version " + Integer.toUnsignedString(version));
        }
        long packetCount = Integer.toUnsignedLong(preamble.getInt());
        if (packetCount == 0 || packetCount > MAX_PACKETS) {
            throw new Crypt4GhException("Invalid number of header packets: " + packetCount);
        }

        byte[] readerPublicKey = Crypt4Gh.publicKey(readerSecretKey);
        List<byte[]> dataKeys = new ArrayList<>();
        long[] editList = null;
        for (int i = 0; i < packetCount; i++) {
            byte[] payload = readPacket(in, readerSecretKey, readerPublicKey, i);
            if (payload == null) {
                continue;
            }
            ByteBuffer packet = ByteBuffer.wrap(payload).order(ByteOrder.LITTLE_ENDIAN);
            int type = requireInt(packet, "packet type");
            if (type == Crypt4Gh.PACKET_TYPE_DATA_ENCRYPTION_PARAMETERS) {
                dataKeys.add(parseDataKey(packet));
            } else if (type == Crypt4Gh.PACKET_TYPE_DATA_EDIT_LIST) {
                if (editList != null) {
                    throw new Crypt4GhException("Header contains more than one edit list for this reader");
                }
                editList = parseEditList(packet);
            } else {
                throw new Crypt4GhException("Unknown header packet type " + Integer.toUnsignedString(type));
            }
        }
        if (dataKeys.isEmpty()) {
            throw new Crypt4GhException("No data encryption key in the header could be decrypted with this key");
        }
        log.debug("Decrypted Crypt4GH header: {} data key(s), edit list: {}.", dataKeys.size(), editList != null);
        return new Crypt4GhHeader(List.copyOf(dataKeys), editList);
    }

    /**
     * @return the decrypted packet payload, or {@code null} if the packet is not readable with our key.
     */
    private static byte[] readPacket(InputStream in, byte[] readerSecretKey, byte[] readerPublicKey, int index)
            throws IOException {
        long length = Integer.toUnsignedLong(
                ByteBuffer.wrap(readFully(in, 4, "packet length")).order(ByteOrder.LITTLE_ENDIAN).getInt());
        if (length < MIN_PACKET_LENGTH || length > MAX_PACKET_LENGTH) {
            throw new Crypt4GhException("Header packet " + index + " has invalid length " + length);
        }
        ByteBuffer packet = ByteBuffer.wrap(readFully(in, (int) length - 4, "packet " + index))
                                      .order(ByteOrder.LITTLE_ENDIAN);
        int method = packet.getInt();
        if (method != Crypt4Gh.METHOD_X25519_CHACHA20_IETF_POLY1305) {
            log.debug("Skipping header packet {} with unsupported encryption method {}.", index, method);
            return null;
        }
        byte[] writerPublicKey = new byte[Crypt4Gh.KEY_SIZE];
        packet.get(writerPublicKey);
        byte[] nonce = new byte[Crypt4Gh.NONCE_SIZE];
        packet.get(nonce);
        try {
            byte[] key = Crypt4Gh.headerKey(readerSecretKey, writerPublicKey, writerPublicKey, readerPublicKey);
            return Crypt4Gh.open(key, nonce, packet.array(), packet.position(), packet.remaining());
        } catch (InvalidCipherTextException | IllegalStateException e) {
            log.debug("Header packet {} is not addressed to this key.", index);
            return null;
        }
    }

    private static byte[] parseDataKey(ByteBuffer packet) throws Crypt4GhException {
        int method = requireInt(packet, "data encryption method");
        if (method != Crypt4Gh.DATA_METHOD_CHACHA20_IETF_POLY1305) {
            throw new Crypt4GhException("Unsupported data encryption method " + Integer.toUnsignedString(method));
        }
        if (packet.remaining() != Crypt4Gh.KEY_SIZE) {
            throw new Crypt4GhException("Data encryption packet has a key of " + packet.remaining() + " bytes");
        }
        byte[] key = new byte[Crypt4Gh.KEY_SIZE];
        packet.get(key);
        return key;
    }

    private static long[] parseEditList(ByteBuffer packet) throws Crypt4GhException {
        long count = Integer.toUnsignedLong(requireInt(packet, "edit list length"));
        if (packet.remaining() != count * Long.BYTES) {
            throw new Crypt4GhException("Edit list declares " + count + " lengths but carries "
                                        + packet.remaining() + " bytes");
        }
        long[] lengths = new long[(int) count];
        for (int i = 0; i < lengths.length; i++) {
            lengths[i] = packet.getLong();
            if (lengths[i] < 0) {
                throw new Crypt4GhException("Edit list length " + i + " is out of range");
            }
        }
        return lengths;
    }

    private static int requireInt(ByteBuffer packet, String field) throws Crypt4GhException {
        if (packet.remaining() < Integer.BYTES) {
            throw new Crypt4GhException("Header packet too short to hold the " + field);
        }
        return packet.getInt();
    }

    private static byte[] readFully(InputStream in, int length, String what) throws IOException {
        byte[] bytes = in.readNBytes(length);
        if (bytes.length != length) {
            throw new Crypt4GhException("Truncated Crypt4GH header while reading the " + what,
                                        new EOFException());
        }
        return bytes;
    }
}
