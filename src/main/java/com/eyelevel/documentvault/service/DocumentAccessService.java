package com.eyelevel.documentvault.service;

import com.eyelevel.documentvault.dto.DocumentAccess;
import com.eyelevel.documentvault.enrichment.DocumentContentReader;
import com.eyelevel.documentvault.exception.OrphanRecordException;
import com.eyelevel.documentvault.exception.RateLimitedException;
import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.exception.StorageObjectNotFoundException;
import com.eyelevel.documentvault.model.AuthenticatedPrincipal;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.ratelimit.RateLimiter;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import com.eyelevel.documentvault.storage.StorageProvider;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.IOUtils;
import org.apache.commons.io.input.BoundedInputStream;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Optional;

/**
 * Serves document and thumbnail reads.
 *
 * <p>Unencrypted documents are handed out as signed URLs where the backend supports them. Encrypted
 * documents are always decrypted and proxied, since a signed URL would only expose ciphertext. A record
 * whose object has disappeared is deleted and reported as not found.
 */
@Slf4j
@Service
public class DocumentAccessService {

    private static final String THUMBNAIL_MIME_TYPE = "image/png";

    private final MetadataStore metadataStore;
    private final StorageProvider storageProvider;
    private final DocumentContentReader contentReader;
    private final RateLimiter rateLimiter;
    private final DocumentDeletionService deletionService;
    private final long signedUrlTtlSeconds;

    public DocumentAccessService(MetadataStore metadataStore, StorageProvider storageProvider,
                                 DocumentContentReader contentReader, RateLimiter rateLimiter,
                                 DocumentDeletionService deletionService,
                                 @Value("${app.storage.signed-url-ttl-seconds:3600}") long signedUrlTtlSeconds) {
        this.metadataStore = metadataStore;
        this.storageProvider = storageProvider;
        this.contentReader = contentReader;
        this.rateLimiter = rateLimiter;
        this.deletionService = deletionService;
        this.signedUrlTtlSeconds = signedUrlTtlSeconds;
    }

    public DocumentAccess openDocument(AuthenticatedPrincipal principal, Long documentId) {
        Optional<DocumentRecord> found = loadStoredRecord(principal, documentId);
        if (found.isEmpty()) {
            return DocumentAccess.notFound();
        }
        DocumentRecord record = found.get();

        if (!record.isEncrypted()) {
            Optional<URL> signedUrl = trySignedUrl(record);
            if (signedUrl.isPresent()) {
                return DocumentAccess.redirect(signedUrl.get(), record.getFileName(), record.getMimeType());
            }
        }
        return openRange(record, 0, Long.MAX_VALUE);
    }

    /**
     * Streams {@code length} plaintext bytes starting at {@code offset}. The length is clamped to the end
     * of the document. Encrypted documents only decrypt the chunks that cover the range.
     *
     * @throws IllegalArgumentException if the range is negative or starts past the end of the document.
     */
    public DocumentAccess openRange(AuthenticatedPrincipal principal, Long documentId, long offset, long length) {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Range offset and length must not be negative");
        }
        Optional<DocumentRecord> found = loadStoredRecord(principal, documentId);
        if (found.isEmpty()) {
            return DocumentAccess.notFound();
        }
        return openRange(found.get(), offset, length);
    }

    /**
     * @throws RateLimitedException if the principal is over its request budget.
     */
    public DocumentAccess openThumbnail(AuthenticatedPrincipal principal, Long documentId) {
        if (!rateLimiter.allow(principal.id())) {
            throw new RateLimitedException("Too many thumbnail requests for user " + principal.id());
        }
        Optional<DocumentRecord> found = loadAuthorizedRecord(principal, documentId);
        if (found.isEmpty() || found.get().getThumbnailKey() == null) {
            return DocumentAccess.notFound();
        }
        DocumentRecord record = found.get();
        try {
            byte[] thumbnail = contentReader.readThumbnail(record);
            return DocumentAccess.content(new ByteArrayInputStream(thumbnail), record.getFileName() + ".png",
                                          THUMBNAIL_MIME_TYPE, thumbnail.length);
        } catch (OrphanRecordException e) {
            log.warn("Thumbnail of document {} is missing from storage; clearing the reference.", documentId);
            metadataStore.updateDocument(documentId, current -> {
                current.setThumbnailKey(null);
                current.setThumbnailCipherMetadata(null);
            });
            return DocumentAccess.notFound();
        }
    }

    private DocumentAccess openRange(DocumentRecord record, long offset, long length) {
        long size = record.getFileSize() != null ? record.getFileSize() : -1;
        if (size >= 0 && offset > size) {
            throw new IllegalArgumentException("Range offset " + offset + " is beyond the document size " + size);
        }
        long contentLength = size >= 0 ? Math.max(0, Math.min(length, size - offset)) : -1;
        try {
            InputStream content = record.isEncrypted()
                    ? contentReader.openPlaintext(record, offset, length)
                    : openUnencryptedRange(record.getStorageKey(), offset, length);
            return DocumentAccess.content(content, record.getFileName(), record.getMimeType(), contentLength);
        } catch (OrphanRecordException | StorageObjectNotFoundException e) {
            deletionService.purgeOrphan(record);
            return DocumentAccess.notFound();
        }
    }

    private InputStream openUnencryptedRange(String storageKey, long offset, long length) {
        InputStream stream = storageProvider.downloadStream(storageKey);
        try {
            IOUtils.skipFully(stream, offset);
            return BoundedInputStream.builder().setInputStream(stream).setMaxCount(length).get();
        } catch (IOException e) {
            IOUtils.closeQuietly(stream);
            throw new StorageException("Failed to read range of '" + storageKey + "'", e);
        }
    }

    private Optional<URL> trySignedUrl(DocumentRecord record) {
        try {
            return Optional.of(storageProvider.getSignedUrl(record.getStorageKey(), signedUrlTtlSeconds));
        } catch (StorageException e) {
            log.debug("Signed URL unavailable for document {}; proxying instead. Cause: {}", record.getId(),
                      e.getMessage());
            return Optional.empty();
        }
    }

    // Missing, unauthorized and orphaned records all read as not found.
    private Optional<DocumentRecord> loadStoredRecord(AuthenticatedPrincipal principal, Long documentId) {
        Optional<DocumentRecord> found = loadAuthorizedRecord(principal, documentId);
        if (found.isPresent() && !storageProvider.exists(found.get().getStorageKey())) {
            deletionService.purgeOrphan(found.get());
            return Optional.empty();
        }
        return found;
    }

    private Optional<DocumentRecord> loadAuthorizedRecord(AuthenticatedPrincipal principal, Long documentId) {
        Optional<DocumentRecord> found = metadataStore.getDocument(documentId);
        if (found.isPresent() && !principal.canAccess(found.get().getUserId(), found.get().getHouseholdId())) {
            log.warn("User {} is not allowed to read document {}.", principal.id(), documentId);
            return Optional.empty();
        }
        return found;
    }
}
