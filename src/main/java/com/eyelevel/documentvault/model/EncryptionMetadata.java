package com.eyelevel.documentvault.model;

import com.eyelevel.documentvault.storage.StorageType;

/**
 * Where and how a document was stored, persisted as JSON on its record.
 */
public record EncryptionMetadata(StorageType storageType, String storageKey, boolean encrypted, String algorithm) {
}
