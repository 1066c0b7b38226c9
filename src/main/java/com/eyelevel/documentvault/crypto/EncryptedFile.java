package com.eyelevel.documentvault.crypto;

import java.nio.file.Path;

/**
 * A ciphertext written to local disk together with the metadata required to read it back.
 */
public record EncryptedFile(Path ciphertextPath, CipherMetadata metadata) {
}
