package com.eyelevel.documentvault.service.metadata;

import com.eyelevel.documentvault.crypto.EncryptedKeyRecord;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.model.EncryptionStats;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Persistence of document records.
 */
public interface MetadataStore {

    Optional<DocumentRecord> getDocument(Long documentId);

    /**
     * @return the stored record with its generated id.
     */
    DocumentRecord createDocument(DocumentRecord record);

    /**
     * Applies {@code mutation} to the current record and saves it.
     *
     * @return the updated record, or empty if the record no longer exists.
     */
    Optional<DocumentRecord> updateDocument(Long documentId, Consumer<DocumentRecord> mutation);

    /**
     * @return {@code true} if a record was deleted.
     */
    boolean deleteDocument(Long documentId);

    List<EncryptedKeyRecord> findEncryptedKeys();

    void updateEncryptedKey(Long documentId, String encryptedDocumentKey);

    EncryptionStats getEncryptionStats();
}
