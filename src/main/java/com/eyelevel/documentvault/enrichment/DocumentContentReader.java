package com.eyelevel.documentvault.enrichment;

import com.eyelevel.documentvault.common.json.JsonParser;
import com.eyelevel.documentvault.crypto.CipherMetadata;
import com.eyelevel.documentvault.crypto.CiphertextSource;
import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.exception.OrphanRecordException;
import com.eyelevel.documentvault.exception.StorageObjectNotFoundException;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.storage.StorageProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.InputStream;

/**
 * Loads stored document bytes and decrypts them with the record's document key.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DocumentContentReader {

    private final StorageProvider storageProvider;
    private final KeyManager keyManager;
    private final JsonParser jsonParser;

    /**
     * @return the full plaintext of the document.
     *
     * @throws OrphanRecordException if the stored object is gone.
     */
    public byte[] readPlaintext(DocumentRecord record) {
        byte[] stored = download(record, record.getStorageKey());
        if (!record.isEncrypted()) {
            return stored;
        }
        return decrypt(record, stored, record.getCipherMetadata());
    }

    /**
     * Opens a plaintext range of an encrypted document. The object is fetched from the start of the chunk
     * holding {@code offset}, and only the chunks covering the range are decrypted.
     *
     * @throws OrphanRecordException if the stored object is gone.
     */
    public InputStream openPlaintext(DocumentRecord record, long offset, long length) {
        CipherMetadata metadata = jsonParser.parseObject(record.getCipherMetadata(), CipherMetadata.class);
        long ciphertextStart = KeyManager.ciphertextOffset(metadata, offset);
        byte[] documentKey = keyManager.decryptDocumentKey(record.getEncryptedDocumentKey());
        try {
            InputStream ciphertext = openRange(record, ciphertextStart);
            log.debug("Reading document {} from ciphertext byte {} for plaintext offset {}.", record.getId(),
                      ciphertextStart, offset);
            return keyManager.createDecryptStream(CiphertextSource.ofStream(ciphertext, ciphertextStart), documentKey,
                                                  metadata, offset, length);
        } finally {
            KeyManager.zero(documentKey);
        }
    }

    /**
     * @return the decrypted thumbnail of the document.
     *
     * @throws OrphanRecordException if the stored thumbnail is gone.
     */
    public byte[] readThumbnail(DocumentRecord record) {
        byte[] stored = download(record, record.getThumbnailKey());
        if (!record.isEncrypted()) {
            return stored;
        }
        return decrypt(record, stored, record.getThumbnailCipherMetadata());
    }

    private byte[] download(DocumentRecord record, String key) {
        try {
            return storageProvider.download(key);
        } catch (StorageObjectNotFoundException e) {
            throw new OrphanRecordException("Document " + record.getId() + " has no stored object at '" + key + "'", e);
        }
    }

    private InputStream openRange(DocumentRecord record, long offset) {
        try {
            return storageProvider.downloadRange(record.getStorageKey(), offset);
        } catch (StorageObjectNotFoundException e) {
            throw new OrphanRecordException("Document " + record.getId() + " has no stored object at '"
                                            + record.getStorageKey() + "'", e);
        }
    }

    private byte[] decrypt(DocumentRecord record, byte[] ciphertext, String cipherMetadataJson) {
        CipherMetadata metadata = jsonParser.parseObject(cipherMetadataJson, CipherMetadata.class);
        byte[] documentKey = keyManager.decryptDocumentKey(record.getEncryptedDocumentKey());
        try {
            return keyManager.decryptBytes(ciphertext, documentKey, metadata);
        } finally {
            KeyManager.zero(documentKey);
        }
    }
}
