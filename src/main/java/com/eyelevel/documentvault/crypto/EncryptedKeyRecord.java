package com.eyelevel.documentvault.crypto;

/**
 * A document id paired with its wrapped document key, as supplied to key rotation.
 */
public record EncryptedKeyRecord(Long documentId, String encryptedDocumentKey) {
}
