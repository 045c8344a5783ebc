package se.nbis.sda.pipeline.crypto;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.crypto.InvalidCipherTextException;
import org.bouncycastle.crypto.PBEParametersGenerator;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.generators.SCrypt;
import org.bouncycastle.crypto.params.KeyParameter;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;

import java.io.IOException;
import java.io.Reader;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Reads X25519 secret keys stored in the Crypt4GH key file format, optionally protected by a passphrase.
 */
@Slf4j
public final class Crypt4GhPrivateKeys {

    public static final String PEM_TYPE = "CRYPT4GH PRIVATE KEY";
    public static final String ENCRYPTED_PEM_TYPE = "CRYPT4GH ENCRYPTED PRIVATE KEY";
    public static final byte[] KEY_MAGIC = "c4gh-v1".getBytes(StandardCharsets.US_ASCII);

    public static final String KDF_NONE = "none";
    public static final String KDF_SCRYPT = "scrypt";
    public static final String KDF_PBKDF2_SHA256 = "pbkdf2_hmac_sha256";
    public static final String KDF_BCRYPT = "bcrypt";
    public static final String CIPHER_NONE = "none";
    public static final String CIPHER_CHACHA20_POLY1305 = "chacha20_poly1305";

    static final int SCRYPT_N = 1 << 14;
    static final int SCRYPT_R = 8;
    static final int SCRYPT_P = 1;

    private Crypt4GhPrivateKeys() {
    }

    public static byte[] read(Path keyFile, char[] passphrase) throws IOException {
        try (Reader reader = Files.newBufferedReader(keyFile, StandardCharsets.US_ASCII)) {
            byte[] secretKey = read(reader, passphrase);
            log.info("Loaded Crypt4GH private key from '{}'.", keyFile);
            return secretKey;
        }
    }

    /**
     * @return the 32 byte X25519 secret key.
     * @throws Crypt4GhException if the key file is malformed, uses an unsupported scheme, or the passphrase is wrong.
     */
    public static byte[] read(Reader pem, char[] passphrase) throws IOException {
        PemObject pemObject;
        try (PemReader reader = new PemReader(pem)) {
            pemObject = reader.readPemObject();
        } catch (DecoderException e) {
            throw new Crypt4GhException("Private key file is not valid PEM", e);
        }
        // The label is informational, the c4gh-v1 content says whether the key is encrypted.
        if (pemObject == null
            || !(PEM_TYPE.equals(pemObject.getType()) || ENCRYPTED_PEM_TYPE.equals(pemObject.getType()))) {
            throw new Crypt4GhException("Private key file does not contain a " + PEM_TYPE + " or "
                                        + ENCRYPTED_PEM_TYPE + " block");
        }
        try {
            return decode(ByteBuffer.wrap(pemObject.getContent()), passphrase);
        } catch (BufferUnderflowException e) {
            throw new Crypt4GhException("Private key file is truncated", e);
        }
    }

    private static byte[] decode(ByteBuffer content, char[] passphrase) throws Crypt4GhException {
        byte[] magic = new byte[KEY_MAGIC.length];
        content.get(magic);
        if (!Arrays.equals(magic, KEY_MAGIC)) {
            throw new Crypt4GhException("Private key file is not in the c4gh-v1 format");
        }
        String kdf = readString(content);
        int rounds = 0;
        byte[] salt = new byte[0];
        if (!KDF_NONE.equals(kdf)) {
            ByteBuffer options = ByteBuffer.wrap(readBytes(content));
            rounds = options.getInt();
            salt = new byte[options.remaining()];
            options.get(salt);
        }
        String cipher = readString(content);
        byte[] data = readBytes(content);

        if (CIPHER_NONE.equals(cipher)) {
            return requireKeyLength(data);
        }
        if (!CIPHER_CHACHA20_POLY1305.equals(cipher)) {
            throw new Crypt4GhException("Unsupported private key cipher '" + cipher + "'");
        }
        if (KDF_NONE.equals(kdf)) {
            throw new Crypt4GhException("Encrypted private key declares no key derivation function");
        }
        if (passphrase == null || passphrase.length == 0) {
            throw new Crypt4GhException("Private key is encrypted but no passphrase was configured");
        }
        if (data.length < Crypt4Gh.NONCE_SIZE + Crypt4Gh.MAC_SIZE) {
            throw new Crypt4GhException("Encrypted private key is too short");
        }
        byte[] derived = deriveKey(kdf, passphrase, salt, rounds);
        try {
            byte[] nonce = Arrays.copyOf(data, Crypt4Gh.NONCE_SIZE);
            return requireKeyLength(Crypt4Gh.open(derived, nonce, data, Crypt4Gh.NONCE_SIZE,
                                                  data.length - Crypt4Gh.NONCE_SIZE));
        } catch (InvalidCipherTextException e) {
            throw new Crypt4GhException("Failed to decrypt private key, wrong passphrase?", e);
        } finally {
            Arrays.fill(derived, (byte) 0);
        }
    }

    static byte[] deriveKey(String kdf, char[] passphrase, byte[] salt, int rounds) throws Crypt4GhException {
        byte[] password = PBEParametersGenerator.PKCS5PasswordToUTF8Bytes(passphrase);
        try {
            switch (kdf) {
                case KDF_SCRYPT:
                    return SCrypt.generate(password, salt, SCRYPT_N, SCRYPT_R, SCRYPT_P, Crypt4Gh.KEY_SIZE);
                case KDF_PBKDF2_SHA256:
                    PKCS5S2ParametersGenerator generator = new PKCS5S2ParametersGenerator(new SHA256Digest());
                    generator.init(password, salt, rounds);
                    return ((KeyParameter) generator.generateDerivedParameters(Crypt4Gh.KEY_SIZE * 8)).getKey();
                case KDF_BCRYPT:
                    throw new Crypt4GhException("The bcrypt key derivation is not supported, re-encrypt the key "
                                                + "with scrypt");
                default:
                    throw new Crypt4GhException("Unknown key derivation function '" + kdf + "'");
            }
        } finally {
            Arrays.fill(password, (byte) 0);
        }
    }

    private static byte[] requireKeyLength(byte[] key) throws Crypt4GhException {
        if (key.length != Crypt4Gh.KEY_SIZE) {
            throw new Crypt4GhException("Private key has " + key.length + " bytes, expected " + Crypt4Gh.KEY_SIZE);
        }
        return key;
    }

    private static String readString(ByteBuffer content) {
        return new String(readBytes(content), StandardCharsets.US_ASCII);
    }

    private static byte[] readBytes(ByteBuffer content) {
        int length = Short.toUnsignedInt(content.getShort());
        byte[] bytes = new byte[length];
        content.get(bytes);
        return bytes;
    }
}
