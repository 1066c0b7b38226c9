package com.eyelevel.documentvault.service;

import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.model.AuthenticatedPrincipal;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import com.eyelevel.documentvault.storage.StorageKeys;
import com.eyelevel.documentvault.storage.StorageProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Removes documents together with their stored objects.
 *
 * <p>Blobs go first and the record last, so a failed delete leaves a record that can be deleted again
 * rather than unreferenced ciphertext. Deleting a missing blob is a no-op, which makes every operation
 * here safe to repeat.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentDeletionService {

    private final MetadataStore metadataStore;
    private final StorageProvider storageProvider;

    /**
     * Deletes a document owned by (or shared with) {@code principal}, including its thumbnail.
     *
     * @return {@code false} if the document does not exist or the principal may not access it.
     *
     * @throws StorageException if a stored object could not be deleted; the record is kept.
     */
    public boolean deleteDocument(AuthenticatedPrincipal principal, Long documentId) {
        Optional<DocumentRecord> found = metadataStore.getDocument(documentId);
        if (found.isEmpty()) {
            return false;
        }
        DocumentRecord record = found.get();
        if (!principal.canAccess(record.getUserId(), record.getHouseholdId())) {
            log.warn("User {} is not allowed to delete document {}.", principal.id(), documentId);
            return false;
        }

        for (String key : storedKeys(record)) {
            storageProvider.delete(key);
        }
        boolean deleted = metadataStore.deleteDocument(documentId);
        log.info("User {} deleted document {} ('{}').", principal.id(), documentId, record.getFileName());
        return deleted;
    }

    /**
     * Drops a record whose document object is gone, along with any thumbnail left behind. Thumbnail
     * failures are logged, since the record is already unusable.
     */
    public void purgeOrphan(DocumentRecord record) {
        log.warn("Document {} has no stored object at '{}'. Deleting the orphaned record.", record.getId(),
                 record.getStorageKey());
        for (String key : thumbnailKeys(record)) {
            try {
                storageProvider.delete(key);
            } catch (StorageException e) {
                log.warn("Failed to delete thumbnail '{}' of orphaned document {}: {}", key, record.getId(),
                         e.getMessage());
            }
        }
        metadataStore.deleteDocument(record.getId());
    }

    private static Set<String> storedKeys(DocumentRecord record) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(record.getStorageKey());
        keys.addAll(thumbnailKeys(record));
        return keys;
    }

    // A thumbnail may have been written before its key reached the record.
    private static Set<String> thumbnailKeys(DocumentRecord record) {
        Set<String> keys = new LinkedHashSet<>();
        if (record.getThumbnailKey() != null) {
            keys.add(record.getThumbnailKey());
        }
        keys.add(StorageKeys.forThumbnail(record.getStorageKey()));
        return keys;
    }
}
