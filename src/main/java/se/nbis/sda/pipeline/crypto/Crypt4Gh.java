package se.nbis.sda.pipeline.crypto;

import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.agreement.X25519Agreement;
import org.bouncycastle.crypto.digests.Blake2bDigest;
import org.bouncycastle.crypto.modes.ChaCha20Poly1305;
import org.bouncycastle.crypto.params.AEADParameters;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.crypto.params.X25519PrivateKeyParameters;
import org.bouncycastle.crypto.params.X25519PublicKeyParameters;

import java.util.Arrays;

/**
 * Constants and primitives of the Crypt4GH v1 format (X25519 key exchange, BLAKE2b key derivation,
 * ChaCha20-IETF-Poly1305 sealing).
 */
public final class Crypt4Gh {

    public static final byte[] MAGIC = {'c', 'r', 'y', 'p', 't', '4', 'g', 'h'};
    public static final int VERSION = 1;

    public static final int METHOD_X25519_CHACHA20_IETF_POLY1305 = 0;
    public static final int DATA_METHOD_CHACHA20_IETF_POLY1305 = 0;
    public static final int PACKET_TYPE_DATA_ENCRYPTION_PARAMETERS = 0;
    public static final int PACKET_TYPE_DATA_EDIT_LIST = 1;

    public static final int KEY_SIZE = 32;
    public static final int NONCE_SIZE = 12;
    public static final int MAC_SIZE = 16;
    public static final int SEGMENT_SIZE = 65_536;
    public static final int CIPHER_SEGMENT_SIZE = NONCE_SIZE + SEGMENT_SIZE + MAC_SIZE;

    private Crypt4Gh() {
    }

    public static byte[] publicKey(byte[] secretKey) {
        return new X25519PrivateKeyParameters(secretKey, 0).generatePublicKey().getEncoded();
    }

    /**
     * Derives the key sealing a header packet. Both sides compute the same value: the first 32 bytes of
     * BLAKE2b-512 over the X25519 shared secret, the reader public key and the writer public key.
     *
     * @param ownSecretKey our X25519 secret key
     * @param peerPublicKey the other party's public key
     * @param writerPublicKey public key of the party that wrote the packet
     * @param readerPublicKey public key of the party the packet is addressed to
     */
    public static byte[] headerKey(byte[] ownSecretKey, byte[] peerPublicKey, byte[] writerPublicKey,
                                   byte[] readerPublicKey) {
        X25519Agreement agreement = new X25519Agreement();
        agreement.init(new X25519PrivateKeyParameters(ownSecretKey, 0));
        byte[] shared = new byte[agreement.getAgreementSize()];
        agreement.calculateAgreement(new X25519PublicKeyParameters(peerPublicKey, 0), shared, 0);

        Blake2bDigest blake2b = new Blake2bDigest(512);
        blake2b.update(shared, 0, shared.length);
        blake2b.update(readerPublicKey, 0, readerPublicKey.length);
        blake2b.update(writerPublicKey, 0, writerPublicKey.length);
        byte[] keys = new byte[64];
        blake2b.doFinal(keys, 0);
        Arrays.fill(shared, (byte) 0);
        return Arrays.copyOf(keys, KEY_SIZE);
    }

    public static byte[] seal(byte[] key, byte[] nonce, byte[] plaintext, int offset, int length) {
        try {
            return process(true, key, nonce, plaintext, offset, length);
        } catch (InvalidCipherTextException e) {
            throw new IllegalStateException("Encryption cannot fail authentication", e);
        }
    }

    /**
     * @throws InvalidCipherTextException if the authentication tag does not match.
     */
    public static byte[] open(byte[] key, byte[] nonce, byte[] ciphertext, int offset, int length)
            throws InvalidCipherTextException {
        return process(false, key, nonce, ciphertext, offset, length);
    }

    private static byte[] process(boolean encrypt, byte[] key, byte[] nonce, byte[] input, int offset, int length)
            throws InvalidCipherTextException {
        ChaCha20Poly1305 cipher = new ChaCha20Poly1305();
        cipher.init(encrypt, new AEADParameters(new KeyParameter(key), MAC_SIZE * 8, nonce));
        byte[] output = new byte[cipher.getOutputSize(length)];
        int written = cipher.processBytes(input, offset, length, output, 0);
        written += cipher.doFinal(output, written);
        return written == output.length ? output : Arrays.copyOf(output, written);
    }
}
