package com.eyelevel.documentvault.crypto;

/**
 * Parameters needed to decrypt a chunked ciphertext produced by {@link KeyManager}.
 *
 * <p>Stored as JSON on the document record next to the wrapped document key. None of the fields
 * are secret; tampering with them is detected when the affected chunk fails authentication.
 *
 * @param algorithm      identifier of the file cipher, e.g. {@code AES-256-GCM-CHUNKED}.
 * @param chunkSize      plaintext bytes per chunk; every chunk except the last is exactly this size.
 * @param noncePrefix    base64 of the random per-file nonce prefix.
 * @param plaintextLength total plaintext length in bytes.
 * @param chunkCount     number of sealed chunks, at least one even for empty input.
 */
public record CipherMetadata(String algorithm, int chunkSize, String noncePrefix, long plaintextLength,
                             long chunkCount) {

    /**
     * @return the size in bytes of the ciphertext this metadata describes.
     */
    public long ciphertextLength() {
        return plaintextLength + chunkCount * KeyManager.TAG_LENGTH_BYTES;
    }
}
