package com.eyelevel.documentvault.service.metadata;

import com.eyelevel.documentvault.crypto.EncryptedKeyRecord;
import com.eyelevel.documentvault.exception.MetadataStoreException;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.model.EncryptionStats;
import com.eyelevel.documentvault.repository.DocumentRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * {@link MetadataStore} backed by Spring Data JPA.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaMetadataStore implements MetadataStore {

    private final DocumentRecordRepository documentRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<DocumentRecord> getDocument(final Long documentId) {
        try {
            return documentRecordRepository.findById(documentId);
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to load document record " + documentId, e);
        }
    }

    @Override
    @Transactional
    public DocumentRecord createDocument(final DocumentRecord record) {
        try {
            final DocumentRecord saved = documentRecordRepository.save(record);
            log.info("Created document record {} for user '{}' at key '{}'.", saved.getId(), saved.getUserId(),
                     saved.getStorageKey());
            return saved;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to create document record for key " + record.getStorageKey(), e);
        }
    }

    @Override
    @Transactional
    public Optional<DocumentRecord> updateDocument(final Long documentId, final Consumer<DocumentRecord> mutation) {
        try {
            return documentRecordRepository.findById(documentId).map(record -> {
                mutation.accept(record);
                return documentRecordRepository.save(record);
            });
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to update document record " + documentId, e);
        }
    }

    @Override
    @Transactional
    public boolean deleteDocument(final Long documentId) {
        try {
            if (!documentRecordRepository.existsById(documentId)) {
                return false;
            }
            documentRecordRepository.deleteById(documentId);
            log.info("Deleted document record {}.", documentId);
            return true;
        } catch (DataAccessException e) {
            throw new MetadataStoreException("Failed to delete document record " + documentId, e);
        }
    }

    @Override
    @Transactional(readOnly = true)
    public List<EncryptedKeyRecord> findEncryptedKeys() {
        return documentRecordRepository.findEncryptedKeys();
    }

    @Override
    @Transactional
    public void updateEncryptedKey(final Long documentId, final String encryptedDocumentKey) {
        final int updated = documentRecordRepository.updateEncryptedKey(documentId, encryptedDocumentKey);
        if (updated == 0) {
            throw new MetadataStoreException("Document record " + documentId + " no longer exists");
        }
    }

    @Override
    @Transactional(readOnly = true)
    public EncryptionStats getEncryptionStats() {
        final long total = documentRecordRepository.count();
        final long encrypted = documentRecordRepository.countByEncrypted(true);
        return new EncryptionStats(total, encrypted, total - encrypted);
    }
}
