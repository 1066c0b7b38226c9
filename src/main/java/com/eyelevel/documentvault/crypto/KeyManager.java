package com.eyelevel.documentvault.crypto;

import com.eyelevel.documentvault.exception.ConfigurationException;
import com.eyelevel.documentvault.exception.DecryptionException;
import com.eyelevel.documentvault.exception.EncryptionException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.io.FileUtils;
import org.apache.commons.io.IOUtils;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.List;
import java.util.function.Supplier;

/**
 * Envelope encryption for stored documents.
 *
 * <p>Every document gets its own random 256-bit key. File contents are sealed with that key using
 * AES-256-GCM over fixed-size chunks, so large files can be encrypted and decrypted as streams and
 * byte ranges can be served without reading the whole object. The document key itself is wrapped
 * with the process-wide master key and persisted next to the record.
 *
 * <p>Wrapped key format (base64): {@code version(1) || nonce(12) || ciphertext+tag(48)}.
 * <br>Chunk format: {@code ciphertext || tag(16)} per chunk, concatenated. The chunk nonce is the
 * per-file random prefix followed by the big-endian chunk index, and the chunk index plus a
 * final-chunk flag are bound as associated data so chunks cannot be reordered, dropped or truncated.
 *
 * <p>The master key is fixed for the lifetime of an instance. Rotation works on explicitly supplied
 * old and new keys and never mutates this instance.
 */
@Slf4j
public class KeyManager {

    public static final String FILE_ALGORITHM = "AES-256-GCM-CHUNKED";
    public static final int DEFAULT_CHUNK_SIZE = 64 * 1024;

    static final String CIPHER_TRANSFORMATION = "AES/GCM/NoPadding";
    static final int TAG_LENGTH_BYTES = 16;

    private static final String KEY_ALGORITHM = "AES";
    private static final int KEY_LENGTH_BYTES = 32;
    private static final int MASTER_KEY_HEX_LENGTH = KEY_LENGTH_BYTES * 2;
    private static final int NONCE_LENGTH_BYTES = 12;
    private static final int NONCE_PREFIX_LENGTH_BYTES = 8;
    private static final int TAG_LENGTH_BITS = TAG_LENGTH_BYTES * 8;
    private static final byte WRAP_FORMAT_VERSION = 1;
    private static final int WRAPPED_KEY_LENGTH = 1 + NONCE_LENGTH_BYTES + KEY_LENGTH_BYTES + TAG_LENGTH_BYTES;
    private static final String SELF_TEST_TEXT = "Document vault encryption self-test";

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();

    private final SecretKeySpec masterKey;
    private final int chunkSize;

    public KeyManager(String masterKeyHex) {
        this(masterKeyHex, DEFAULT_CHUNK_SIZE);
    }

    /**
     * @param masterKeyHex the master key as exactly 64 hexadecimal characters.
     * @param chunkSize    plaintext bytes per sealed chunk for newly encrypted files.
     *
     * @throws ConfigurationException if the master key is missing or malformed.
     */
    public KeyManager(String masterKeyHex, int chunkSize) {
        if (chunkSize <= 0) {
            throw new ConfigurationException("Encryption chunk size must be positive, got " + chunkSize);
        }
        this.masterKey = parseMasterKey(masterKeyHex);
        this.chunkSize = chunkSize;
        log.info("KeyManager initialized with {}-byte chunks.", chunkSize);
    }

    /**
     * Generates a fresh master key suitable for the {@code DOCUMENT_MASTER_KEY} setting.
     *
     * @return 64 lowercase hexadecimal characters.
     */
    public static String generateMasterKey() {
        return Hex.encodeHexString(randomBytes(KEY_LENGTH_BYTES));
    }

    /**
     * @return a new random 32-byte document key. Callers should zero it once wrapped.
     */
    public byte[] generateDocumentKey() {
        return randomBytes(KEY_LENGTH_BYTES);
    }

    public String encryptDocumentKey(byte[] documentKey) {
        return wrapKey(masterKey, documentKey);
    }

    /**
     * @throws DecryptionException if the wrapped key is malformed or was not produced under this
     *                             master key.
     */
    public byte[] decryptDocumentKey(String encryptedDocumentKey) {
        return unwrapKey(masterKey, encryptedDocumentKey);
    }

    /**
     * Encrypts a plaintext file into a sibling {@code .enc} file.
     *
     * @param plaintextPath the file to encrypt. It is left in place.
     * @param documentKey   the 32-byte document key.
     *
     * @return the ciphertext location and the metadata needed to decrypt it.
     *
     * @throws EncryptionException if the file cannot be read or written. No partial output is left.
     */
    public EncryptedFile encryptFile(Path plaintextPath, byte[] documentKey) {
        Path ciphertextPath = plaintextPath.resolveSibling(plaintextPath.getFileName() + ".enc");
        try (InputStream in = new BufferedInputStream(Files.newInputStream(plaintextPath));
             OutputStream out = new BufferedOutputStream(Files.newOutputStream(ciphertextPath))) {
            CipherMetadata metadata = encryptStream(in, out, documentKey);
            log.debug("Encrypted '{}' into {} chunk(s), {} plaintext bytes.", plaintextPath.getFileName(),
                      metadata.chunkCount(), metadata.plaintextLength());
            return new EncryptedFile(ciphertextPath, metadata);
        } catch (IOException | RuntimeException e) {
            deletePartialOutput(ciphertextPath);
            if (e instanceof EncryptionException encryptionException) {
                throw encryptionException;
            }
            throw new EncryptionException("Failed to encrypt file " + plaintextPath.getFileName(), e);
        }
    }

    /**
     * Encrypts a small in-memory payload, such as a rendered thumbnail, with the same chunked format.
     */
    public EncryptedBytes encryptBytes(byte[] plaintext, byte[] documentKey) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(plaintext.length + TAG_LENGTH_BYTES);
        try {
            CipherMetadata metadata = encryptStream(new ByteArrayInputStream(plaintext), out, documentKey);
            return new EncryptedBytes(out.toByteArray(), metadata);
        } catch (IOException e) {
            throw new EncryptionException("Failed to encrypt in-memory payload", e);
        }
    }

    public InputStream createDecryptStream(Path ciphertextPath, byte[] documentKey, CipherMetadata metadata) {
        return createDecryptStream(ciphertextPath, documentKey, metadata, 0, metadata.plaintextLength());
    }

    /**
     * Opens a stream over a byte range of the plaintext. Only the chunks covering the range are read.
     *
     * @param offset first plaintext byte to return.
     * @param length maximum number of bytes to return; clamped to the end of the plaintext.
     */
    public InputStream createDecryptStream(Path ciphertextPath, byte[] documentKey, CipherMetadata metadata,
                                           long offset, long length) {
        try {
            return openStream(CiphertextSource.ofFile(ciphertextPath), documentKey, metadata, offset, length);
        } catch (IOException e) {
            throw new DecryptionException("Failed to open ciphertext " + ciphertextPath.getFileName(), e);
        }
    }

    public InputStream createDecryptStream(byte[] ciphertext, byte[] documentKey, CipherMetadata metadata) {
        return createDecryptStream(ciphertext, documentKey, metadata, 0, metadata.plaintextLength());
    }

    public InputStream createDecryptStream(byte[] ciphertext, byte[] documentKey, CipherMetadata metadata,
                                           long offset, long length) {
        return openStream(CiphertextSource.ofBytes(ciphertext), documentKey, metadata, offset, length);
    }

    /**
     * Opens a stream over a byte range of the plaintext read from {@code source}. The source is closed
     * with the stream, or right away if the stream cannot be opened.
     */
    public InputStream createDecryptStream(CiphertextSource source, byte[] documentKey, CipherMetadata metadata,
                                           long offset, long length) {
        return openStream(source, documentKey, metadata, offset, length);
    }

    /**
     * @return the ciphertext position of the chunk holding plaintext byte {@code plaintextOffset}. Offsets at
     *         or past the end map to the last chunk.
     *
     * @throws IllegalArgumentException if the offset is negative.
     */
    public static long ciphertextOffset(CipherMetadata metadata, long plaintextOffset) {
        if (plaintextOffset < 0) {
            throw new IllegalArgumentException("Range offset must not be negative");
        }
        long chunkIndex = Math.min(plaintextOffset / metadata.chunkSize(), Math.max(0, metadata.chunkCount() - 1));
        return chunkIndex * ((long) metadata.chunkSize() + TAG_LENGTH_BYTES);
    }

    /**
     * Decrypts an in-memory ciphertext completely.
     */
    public byte[] decryptBytes(byte[] ciphertext, byte[] documentKey, CipherMetadata metadata) {
        try (InputStream in = createDecryptStream(ciphertext, documentKey, metadata)) {
            return IOUtils.toByteArray(in);
        } catch (IOException e) {
            throw new DecryptionException("Failed to decrypt in-memory payload", e);
        }
    }

    /**
     * Re-wraps every supplied document key from {@code oldMasterKeyHex} to {@code newMasterKeyHex}.
     *
     * <p>Never stops at the first bad record: a key that cannot be unwrapped with the old master key is
     * reported in {@link RotationResult#failed()} and processing continues. Persisting the succeeded
     * records is the caller's job.
     *
     * @throws ConfigurationException if either master key is malformed.
     */
    public RotationResult rotateDocumentKeys(String oldMasterKeyHex, String newMasterKeyHex,
                                             Supplier<List<EncryptedKeyRecord>> recordSupplier) {
        SecretKeySpec oldKey = parseMasterKey(oldMasterKeyHex);
        SecretKeySpec newKey = parseMasterKey(newMasterKeyHex);
        List<EncryptedKeyRecord> records = recordSupplier.get();
        log.info("Starting document key rotation for {} record(s).", records.size());

        List<RotationResult.RotatedKey> succeeded = new ArrayList<>();
        List<RotationResult.RotationFailure> failed = new ArrayList<>();
        for (EncryptedKeyRecord keyRecord : records) {
            byte[] documentKey = null;
            try {
                documentKey = unwrapKey(oldKey, keyRecord.encryptedDocumentKey());
                succeeded.add(new RotationResult.RotatedKey(keyRecord.documentId(), wrapKey(newKey, documentKey)));
            } catch (RuntimeException e) {
                log.warn("Failed to rotate key for document {}: {}", keyRecord.documentId(), e.getMessage());
                failed.add(new RotationResult.RotationFailure(keyRecord.documentId(), e.getMessage()));
            } finally {
                zero(documentKey);
            }
        }

        log.info("Key rotation finished. Succeeded: {}, failed: {}.", succeeded.size(), failed.size());
        return new RotationResult(succeeded, failed);
    }

    /**
     * Round-trips a fixed text through key wrapping and file encryption.
     *
     * @return {@code true} if every step produced the original input.
     */
    public boolean testEncryption() {
        byte[] documentKey = generateDocumentKey();
        Path workDir = null;
        try {
            byte[] unwrapped = decryptDocumentKey(encryptDocumentKey(documentKey));
            if (!MessageDigest.isEqual(documentKey, unwrapped)) {
                log.error("Encryption self-test failed: unwrapped document key does not match.");
                return false;
            }

            workDir = Files.createTempDirectory("vault-selftest-");
            Path plaintext = Files.writeString(workDir.resolve("selftest.txt"), SELF_TEST_TEXT);
            EncryptedFile encrypted = encryptFile(plaintext, documentKey);
            try (InputStream in = createDecryptStream(encrypted.ciphertextPath(), documentKey,
                                                      encrypted.metadata())) {
                String decrypted = new String(IOUtils.toByteArray(in), StandardCharsets.UTF_8);
                boolean passed = SELF_TEST_TEXT.equals(decrypted);
                if (!passed) {
                    log.error("Encryption self-test failed: decrypted text does not match.");
                }
                return passed;
            }
        } catch (Exception e) {
            log.error("Encryption self-test failed.", e);
            return false;
        } finally {
            zero(documentKey);
            deleteSelfTestDirectory(workDir);
        }
    }

    public int getChunkSize() {
        return chunkSize;
    }

    /**
     * Overwrites key material held in a byte array.
     */
    public static void zero(byte[] keyMaterial) {
        if (keyMaterial != null) {
            Arrays.fill(keyMaterial, (byte) 0);
        }
    }

    static byte[] openChunk(Cipher cipher, SecretKeySpec documentKey, byte[] noncePrefix, long chunkIndex,
                            boolean lastChunk, byte[] sealed) {
        try {
            cipher.init(Cipher.DECRYPT_MODE, documentKey,
                        new GCMParameterSpec(TAG_LENGTH_BITS, chunkNonce(noncePrefix, chunkIndex)));
            cipher.updateAAD(chunkAad(chunkIndex, lastChunk));
            return cipher.doFinal(sealed);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Authentication failed for chunk " + chunkIndex
                                          + "; the ciphertext was modified or the key is wrong", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to decrypt chunk " + chunkIndex, e);
        }
    }

    private CipherMetadata encryptStream(InputStream in, OutputStream out, byte[] documentKey) throws IOException {
        SecretKeySpec key = toDocumentKeySpec(documentKey);
        byte[] noncePrefix = randomBytes(NONCE_PREFIX_LENGTH_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            byte[] current = new byte[chunkSize];
            byte[] next = new byte[chunkSize];
            int currentLength = IOUtils.read(in, current);
            long chunkIndex = 0;
            long plaintextLength = 0;

            while (true) {
                // a short chunk is always the last one; a full chunk needs a look-ahead read
                int nextLength = currentLength == chunkSize ? IOUtils.read(in, next) : 0;
                boolean lastChunk = nextLength == 0;

                cipher.init(Cipher.ENCRYPT_MODE, key,
                            new GCMParameterSpec(TAG_LENGTH_BITS, chunkNonce(noncePrefix, chunkIndex)));
                cipher.updateAAD(chunkAad(chunkIndex, lastChunk));
                out.write(cipher.doFinal(current, 0, currentLength));

                plaintextLength += currentLength;
                chunkIndex++;
                if (lastChunk) {
                    break;
                }
                if (chunkIndex == Integer.MAX_VALUE) {
                    throw new EncryptionException("Input exceeds the maximum number of chunks");
                }
                byte[] swap = current;
                current = next;
                next = swap;
                currentLength = nextLength;
            }
            out.flush();

            return new CipherMetadata(FILE_ALGORITHM, chunkSize, Base64.getEncoder().encodeToString(noncePrefix),
                                      plaintextLength, chunkIndex);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Cipher failure while encrypting", e);
        }
    }

    private InputStream openStream(CiphertextSource source, byte[] documentKey, CipherMetadata metadata,
                                   long offset, long length) {
        try {
            validateMetadata(metadata);
            if (offset < 0 || length < 0) {
                throw new IllegalArgumentException("Range offset and length must not be negative");
            }
            if (offset > metadata.plaintextLength()) {
                throw new IllegalArgumentException(
                        "Range offset " + offset + " is beyond the plaintext length " + metadata.plaintextLength());
            }
            long boundedLength = Math.min(length, metadata.plaintextLength() - offset);
            byte[] noncePrefix = Base64.getDecoder().decode(metadata.noncePrefix());
            if (noncePrefix.length != NONCE_PREFIX_LENGTH_BYTES) {
                throw new DecryptionException("Cipher metadata has an invalid nonce prefix");
            }
            return new ChunkedDecryptingInputStream(source, toDocumentKeySpec(documentKey), metadata, noncePrefix,
                                                    offset, boundedLength);
        } catch (IOException | GeneralSecurityException | RuntimeException e) {
            closeQuietly(source);
            if (e instanceof RuntimeException runtimeException
                && (e instanceof DecryptionException || e instanceof IllegalArgumentException)) {
                throw runtimeException;
            }
            throw new DecryptionException("Failed to open decrypt stream", e);
        }
    }

    private static void validateMetadata(CipherMetadata metadata) {
        if (metadata == null || !FILE_ALGORITHM.equals(metadata.algorithm())) {
            throw new DecryptionException("Unsupported or missing cipher metadata");
        }
        if (metadata.chunkSize() <= 0 || metadata.plaintextLength() < 0) {
            throw new DecryptionException("Cipher metadata has invalid sizes");
        }
        long expectedChunks = Math.max(1, (metadata.plaintextLength() + metadata.chunkSize() - 1)
                                          / metadata.chunkSize());
        if (metadata.chunkCount() != expectedChunks) {
            throw new DecryptionException("Cipher metadata declares " + metadata.chunkCount()
                                          + " chunk(s) but the plaintext length requires " + expectedChunks);
        }
    }

    private static String wrapKey(SecretKeySpec keyEncryptionKey, byte[] documentKey) {
        if (documentKey == null || documentKey.length != KEY_LENGTH_BYTES) {
            throw new EncryptionException("Document key must be " + KEY_LENGTH_BYTES + " bytes");
        }
        byte[] nonce = randomBytes(NONCE_LENGTH_BYTES);
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, keyEncryptionKey, new GCMParameterSpec(TAG_LENGTH_BITS, nonce));
            cipher.updateAAD(new byte[]{WRAP_FORMAT_VERSION});
            byte[] sealed = cipher.doFinal(documentKey);
            ByteBuffer wrapped = ByteBuffer.allocate(WRAPPED_KEY_LENGTH)
                                           .put(WRAP_FORMAT_VERSION)
                                           .put(nonce)
                                           .put(sealed);
            return Base64.getEncoder().encodeToString(wrapped.array());
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("Failed to wrap document key", e);
        }
    }

    private static byte[] unwrapKey(SecretKeySpec keyEncryptionKey, String encryptedDocumentKey) {
        if (encryptedDocumentKey == null || encryptedDocumentKey.isBlank()) {
            throw new DecryptionException("Encrypted document key is missing");
        }
        byte[] wrapped;
        try {
            wrapped = Base64.getDecoder().decode(encryptedDocumentKey.trim());
        } catch (IllegalArgumentException e) {
            throw new DecryptionException("Encrypted document key is not valid base64", e);
        }
        if (wrapped.length != WRAPPED_KEY_LENGTH || wrapped[0] != WRAP_FORMAT_VERSION) {
            throw new DecryptionException("Encrypted document key has an unknown format");
        }
        try {
            Cipher cipher = Cipher.getInstance(CIPHER_TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, keyEncryptionKey,
                        new GCMParameterSpec(TAG_LENGTH_BITS, wrapped, 1, NONCE_LENGTH_BYTES));
            cipher.updateAAD(wrapped, 0, 1);
            return cipher.doFinal(wrapped, 1 + NONCE_LENGTH_BYTES, wrapped.length - 1 - NONCE_LENGTH_BYTES);
        } catch (AEADBadTagException e) {
            throw new DecryptionException("Document key authentication failed; wrong master key or tampered key", e);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Failed to unwrap document key", e);
        }
    }

    private static SecretKeySpec parseMasterKey(String masterKeyHex) {
        if (masterKeyHex == null || masterKeyHex.isBlank()) {
            throw new ConfigurationException("Master key is not configured. Set DOCUMENT_MASTER_KEY.");
        }
        String trimmed = masterKeyHex.trim();
        if (trimmed.length() != MASTER_KEY_HEX_LENGTH) {
            throw new ConfigurationException(
                    "Master key must be exactly " + MASTER_KEY_HEX_LENGTH + " hex characters, got " + trimmed.length());
        }
        try {
            return new SecretKeySpec(Hex.decodeHex(trimmed), KEY_ALGORITHM);
        } catch (DecoderException e) {
            throw new ConfigurationException("Master key must contain only hexadecimal characters", e);
        }
    }

    private static SecretKeySpec toDocumentKeySpec(byte[] documentKey) {
        if (documentKey == null || documentKey.length != KEY_LENGTH_BYTES) {
            throw new EncryptionException("Document key must be " + KEY_LENGTH_BYTES + " bytes");
        }
        return new SecretKeySpec(documentKey, KEY_ALGORITHM);
    }

    private static byte[] chunkNonce(byte[] noncePrefix, long chunkIndex) {
        return ByteBuffer.allocate(NONCE_LENGTH_BYTES).put(noncePrefix).putInt((int) chunkIndex).array();
    }

    private static byte[] chunkAad(long chunkIndex, boolean lastChunk) {
        return ByteBuffer.allocate(Long.BYTES + 1).putLong(chunkIndex).put((byte) (lastChunk ? 1 : 0)).array();
    }

    private static byte[] randomBytes(int length) {
        byte[] bytes = new byte[length];
        SECURE_RANDOM.nextBytes(bytes);
        return bytes;
    }

    private static void deletePartialOutput(Path ciphertextPath) {
        try {
            Files.deleteIfExists(ciphertextPath);
        } catch (IOException e) {
            log.warn("Failed to delete partial ciphertext {}", ciphertextPath, e);
        }
    }

    private static void deleteSelfTestDirectory(Path workDir) {
        if (workDir == null) {
            return;
        }
        try {
            FileUtils.deleteDirectory(workDir.toFile());
        } catch (IOException e) {
            log.warn("Failed to delete self-test directory {}", workDir, e);
        }
    }

    private static void closeQuietly(CiphertextSource source) {
        try {
            source.close();
        } catch (IOException e) {
            log.warn("Failed to close ciphertext source", e);
        }
    }
}
