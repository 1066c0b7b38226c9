package com.eyelevel.documentvault.crypto;

/**
 * An in-memory ciphertext together with the metadata required to read it back.
 */
public record EncryptedBytes(byte[] ciphertext, CipherMetadata metadata) {
}
