package com.eyelevel.documentvault.support;

import com.eyelevel.documentvault.crypto.EncryptedKeyRecord;
import com.eyelevel.documentvault.exception.MetadataStoreException;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.model.EncryptionStats;
import com.eyelevel.documentvault.service.metadata.MetadataStore;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Map-backed {@link MetadataStore} for tests. Returns copies so callers cannot mutate stored records.
 */
public class InMemoryMetadataStore implements MetadataStore {

    private final Map<Long, DocumentRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();

    @Override
    public Optional<DocumentRecord> getDocument(Long documentId) {
        return Optional.ofNullable(records.get(documentId)).map(record -> record.toBuilder().build());
    }

    @Override
    public DocumentRecord createDocument(DocumentRecord record) {
        boolean duplicateKey = records.values().stream()
                                      .anyMatch(existing -> existing.getStorageKey().equals(record.getStorageKey()));
        if (duplicateKey) {
            throw new MetadataStoreException("Duplicate storage key " + record.getStorageKey());
        }
        DocumentRecord stored = record.toBuilder().id(ids.incrementAndGet()).createdAt(LocalDateTime.now())
                                      .updatedAt(LocalDateTime.now()).build();
        records.put(stored.getId(), stored);
        return stored.toBuilder().build();
    }

    @Override
    public Optional<DocumentRecord> updateDocument(Long documentId, Consumer<DocumentRecord> mutation) {
        DocumentRecord updated = records.computeIfPresent(documentId, (id, current) -> {
            DocumentRecord copy = current.toBuilder().build();
            mutation.accept(copy);
            copy.setUpdatedAt(LocalDateTime.now());
            return copy;
        });
        return Optional.ofNullable(updated).map(record -> record.toBuilder().build());
    }

    @Override
    public boolean deleteDocument(Long documentId) {
        return records.remove(documentId) != null;
    }

    @Override
    public List<EncryptedKeyRecord> findEncryptedKeys() {
        return records.values().stream().filter(DocumentRecord::isEncrypted)
                      .filter(record -> record.getEncryptedDocumentKey() != null)
                      .sorted(Comparator.comparing(DocumentRecord::getId))
                      .map(record -> new EncryptedKeyRecord(record.getId(), record.getEncryptedDocumentKey()))
                      .toList();
    }

    @Override
    public void updateEncryptedKey(Long documentId, String encryptedDocumentKey) {
        if (updateDocument(documentId, record -> record.setEncryptedDocumentKey(encryptedDocumentKey)).isEmpty()) {
            throw new MetadataStoreException("Document " + documentId + " not found");
        }
    }

    @Override
    public EncryptionStats getEncryptionStats() {
        long encrypted = records.values().stream().filter(DocumentRecord::isEncrypted).count();
        return new EncryptionStats(records.size(), encrypted, records.size() - encrypted);
    }

    public int size() {
        return records.size();
    }

    public List<DocumentRecord> all() {
        return records.values().stream().map(record -> record.toBuilder().build()).toList();
    }
}
