package com.eyelevel.documentvault.enrichment.handler;

import com.eyelevel.documentvault.common.json.JsonSerializer;
import com.eyelevel.documentvault.crypto.EncryptedBytes;
import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.enrichment.DocumentContentReader;
import com.eyelevel.documentvault.enrichment.thumbnail.ThumbnailRenderer;
import com.eyelevel.documentvault.exception.OrphanRecordException;
import com.eyelevel.documentvault.job.Job;
import com.eyelevel.documentvault.job.JobHandler;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.JobType;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.service.DocumentDeletionService;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import com.eyelevel.documentvault.storage.StorageKeys;
import com.eyelevel.documentvault.storage.StorageProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Renders a thumbnail for a stored document and stores it next to the document, encrypted with the
 * same document key when the document is encrypted.
 *
 * <p>The thumbnail key is derived from the document key, so a re-run overwrites the previous thumbnail.
 */
@Slf4j
@Component
public class ThumbnailJobHandler implements JobHandler {

    private static final String PNG_MIME_TYPE = "image/png";

    private final MetadataStore metadataStore;
    private final DocumentContentReader contentReader;
    private final ThumbnailRenderer thumbnailRenderer;
    private final StorageProvider storageProvider;
    private final KeyManager keyManager;
    private final JsonSerializer jsonSerializer;
    private final DocumentDeletionService deletionService;
    private final int thumbnailWidth;

    public ThumbnailJobHandler(MetadataStore metadataStore, DocumentContentReader contentReader,
                               ThumbnailRenderer thumbnailRenderer, StorageProvider storageProvider,
                               KeyManager keyManager, JsonSerializer jsonSerializer,
                               DocumentDeletionService deletionService,
                               @Value("${app.processing.thumbnail-width:240}") int thumbnailWidth) {
        this.metadataStore = metadataStore;
        this.contentReader = contentReader;
        this.thumbnailRenderer = thumbnailRenderer;
        this.storageProvider = storageProvider;
        this.keyManager = keyManager;
        this.jsonSerializer = jsonSerializer;
        this.deletionService = deletionService;
        this.thumbnailWidth = thumbnailWidth;
    }

    @Override
    public JobType getJobType() {
        return JobType.THUMBNAIL;
    }

    @Override
    public void handle(Job job, JobSubmitter submitter) throws Exception {
        Long documentId = job.getPayload().documentId();
        String contextInfo = String.format("JobId: %s, DocumentId: %d", job.getId(), documentId);

        Optional<DocumentRecord> found = metadataStore.getDocument(documentId);
        if (found.isEmpty()) {
            log.info("[{}] Document no longer exists; no thumbnail needed.", contextInfo);
            return;
        }
        DocumentRecord record = found.get();
        if (!thumbnailRenderer.supports(record.getMimeType())) {
            log.debug("[{}] No thumbnail for mime type '{}'.", contextInfo, record.getMimeType());
            return;
        }

        byte[] content;
        try {
            content = contentReader.readPlaintext(record);
        } catch (OrphanRecordException e) {
            log.warn("[{}] {}. Removing the orphaned record.", contextInfo, e.getMessage());
            deletionService.purgeOrphan(record);
            return;
        }

        byte[] png = thumbnailRenderer.renderPng(content, record.getMimeType(), thumbnailWidth);
        String thumbnailKey = StorageKeys.forThumbnail(record.getStorageKey());

        Optional<DocumentRecord> updated;
        if (record.isEncrypted()) {
            byte[] documentKey = keyManager.decryptDocumentKey(record.getEncryptedDocumentKey());
            try {
                EncryptedBytes encrypted = keyManager.encryptBytes(png, documentKey);
                storageProvider.upload(encrypted.ciphertext(), thumbnailKey, PNG_MIME_TYPE);
                String cipherMetadata = jsonSerializer.serialize(encrypted.metadata());
                updated = metadataStore.updateDocument(documentId, current -> {
                    current.setThumbnailKey(thumbnailKey);
                    current.setThumbnailCipherMetadata(cipherMetadata);
                });
            } finally {
                KeyManager.zero(documentKey);
            }
        } else {
            storageProvider.upload(png, thumbnailKey, PNG_MIME_TYPE);
            updated = metadataStore.updateDocument(documentId, current -> current.setThumbnailKey(thumbnailKey));
        }
        if (updated.isEmpty()) {
            log.info("[{}] Document was deleted while rendering; removing the new thumbnail.", contextInfo);
            storageProvider.delete(thumbnailKey);
            return;
        }
        log.info("[{}] Stored {}-byte thumbnail at '{}'.", contextInfo, png.length, thumbnailKey);
    }
}
