package com.eyelevel.documentvault.service;

import com.eyelevel.documentvault.common.json.JsonSerializer;
import com.eyelevel.documentvault.crypto.CipherMetadata;
import com.eyelevel.documentvault.crypto.EncryptedFile;
import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.dto.IngestRequest;
import com.eyelevel.documentvault.exception.FileConversionException;
import com.eyelevel.documentvault.exception.JobRejectedException;
import com.eyelevel.documentvault.exception.MetadataStoreException;
import com.eyelevel.documentvault.exception.RateLimitedException;
import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.exception.VaultException;
import com.eyelevel.documentvault.job.JobPayload;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.JobType;
import com.eyelevel.documentvault.model.AuthenticatedPrincipal;
import com.eyelevel.documentvault.model.ConversionStatus;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.model.EncryptionMetadata;
import com.eyelevel.documentvault.ratelimit.RateLimiter;
import com.eyelevel.documentvault.service.conversion.ConversionEngine;
import com.eyelevel.documentvault.service.conversion.ConvertedFile;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import com.eyelevel.documentvault.storage.StorageKeys;
import com.eyelevel.documentvault.storage.StorageProvider;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Hex;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.io.FileUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs the synchronous part of an upload: spool, optional conversion, encryption, storage and record
 * creation. Enrichment is queued afterwards and never fails the upload.
 *
 * <p>A document record is only created once its object is stored. If anything fails after the upload,
 * the stored object is deleted again before the error is rethrown.
 */
@Slf4j
@Service
public class DocumentIngestionService {

    private static final String CIPHERTEXT_MIME_TYPE = "application/octet-stream";

    private final RateLimiter rateLimiter;
    private final ValidationService validationService;
    private final ConversionEngine conversionEngine;
    private final KeyManager keyManager;
    private final StorageProvider storageProvider;
    private final MetadataStore metadataStore;
    private final JobSubmitter jobSubmitter;
    private final JsonSerializer jsonSerializer;
    private final boolean encryptionEnabled;

    public DocumentIngestionService(RateLimiter rateLimiter, ValidationService validationService,
                                    ConversionEngine conversionEngine, KeyManager keyManager,
                                    StorageProvider storageProvider, MetadataStore metadataStore,
                                    JobSubmitter jobSubmitter, JsonSerializer jsonSerializer,
                                    @Value("${app.encryption.enabled:true}") boolean encryptionEnabled) {
        this.rateLimiter = rateLimiter;
        this.validationService = validationService;
        this.conversionEngine = conversionEngine;
        this.keyManager = keyManager;
        this.storageProvider = storageProvider;
        this.metadataStore = metadataStore;
        this.jobSubmitter = jobSubmitter;
        this.jsonSerializer = jsonSerializer;
        this.encryptionEnabled = encryptionEnabled;
    }

    /**
     * Stores an upload for {@code principal} and queues its enrichment.
     *
     * @return the persisted document record.
     *
     * @throws RateLimitedException if the principal is over its request budget.
     * @throws com.eyelevel.documentvault.exception.ValidationException if the upload is empty, too large or badly named.
     * @throws StorageException if the upload could not be staged or stored; no record is created.
     * @throws MetadataStoreException if the record could not be created; the stored object is removed.
     */
    public DocumentRecord ingest(final AuthenticatedPrincipal principal, final IngestRequest request) {
        if (!rateLimiter.allow(principal.id())) {
            throw new RateLimitedException("Too many uploads for user " + principal.id() + "; try again later.");
        }
        validationService.validateFileName(request.fileName());

        final String contextInfo = String.format("User: %s, File: %s", principal.id(), request.fileName());
        log.info("[{}] Starting ingestion.", contextInfo);

        Path workDir = null;
        byte[] documentKey = null;
        try {
            workDir = Files.createTempDirectory("vault-ingest-");
            final Path spooled = workDir.resolve(StorageKeys.sanitizeFileName(request.fileName()));
            final MessageDigest uploadDigest = DigestUtils.getSha256Digest();
            final long uploadedSize = spool(request.content(), spooled, uploadDigest);
            validationService.validateFile(request.fileName(), uploadedSize);

            final StagedFile staged = convertIfNeeded(spooled, request, contextInfo);
            final String contentHash = staged.path().equals(spooled)
                    ? Hex.encodeHexString(uploadDigest.digest())
                    : sha256Hex(staged.path());
            final long plaintextSize = Files.size(staged.path());

            final String storageKey = StorageKeys.forDocument(principal.id(), UUID.randomUUID().toString(),
                                                              staged.fileName());
            CipherMetadata cipherMetadata = null;
            if (encryptionEnabled) {
                documentKey = keyManager.generateDocumentKey();
                final EncryptedFile encrypted = keyManager.encryptFile(staged.path(), documentKey);
                cipherMetadata = encrypted.metadata();
                storageProvider.uploadFile(encrypted.ciphertextPath(), storageKey, CIPHERTEXT_MIME_TYPE);
            } else {
                storageProvider.uploadFile(staged.path(), storageKey, staged.mimeType());
            }
            log.info("[{}] Stored {} bytes at '{}' (encrypted: {}).", contextInfo, plaintextSize, storageKey,
                     encryptionEnabled);

            final DocumentRecord saved = createRecord(principal, staged, storageKey, documentKey, cipherMetadata,
                                                      contentHash, plaintextSize, contextInfo);
            enqueueEnrichment(saved, contextInfo);
            return saved;
        } catch (IOException e) {
            throw new StorageException("Failed to stage upload '" + request.fileName() + "'", e);
        } finally {
            KeyManager.zero(documentKey);
            cleanupWorkDir(workDir, contextInfo);
        }
    }

    private DocumentRecord createRecord(AuthenticatedPrincipal principal, StagedFile staged, String storageKey,
                                        byte[] documentKey, CipherMetadata cipherMetadata, String contentHash,
                                        long plaintextSize, String contextInfo) {
        try {
            final String algorithm = encryptionEnabled ? KeyManager.FILE_ALGORITHM : null;
            final EncryptionMetadata encryptionMetadata = new EncryptionMetadata(
                    storageProvider.getStorageType(), storageKey, encryptionEnabled, algorithm);

            final DocumentRecord record = DocumentRecord.builder().userId(principal.id())
                                                        .householdId(principal.householdId())
                                                        .fileName(staged.fileName()).mimeType(staged.mimeType())
                                                        .fileSize(plaintextSize).contentHash(contentHash)
                                                        .storageKey(storageKey)
                                                        .storageType(storageProvider.getStorageType())
                                                        .encrypted(encryptionEnabled)
                                                        .encryptedDocumentKey(encryptionEnabled
                                                                ? keyManager.encryptDocumentKey(documentKey)
                                                                : null)
                                                        .encryptionMetadata(jsonSerializer.serialize(encryptionMetadata))
                                                        .cipherMetadata(cipherMetadata != null
                                                                ? jsonSerializer.serialize(cipherMetadata)
                                                                : null)
                                                        .conversionStatus(staged.conversionStatus()).build();

            final DocumentRecord saved = metadataStore.createDocument(record);
            log.info("[{}] Created document record {}.", contextInfo, saved.getId());
            return saved;
        } catch (RuntimeException e) {
            log.error("[{}] Failed to record stored object '{}'. Removing it.", contextInfo, storageKey, e);
            compensateUpload(storageKey, e, contextInfo);
            if (e instanceof VaultException) {
                throw e;
            }
            throw new MetadataStoreException("Failed to create document record for '" + storageKey + "'", e);
        }
    }

    private void compensateUpload(String storageKey, RuntimeException cause, String contextInfo) {
        try {
            storageProvider.delete(storageKey);
        } catch (RuntimeException deleteFailure) {
            log.error("[{}] CRITICAL: compensating delete of '{}' failed; the object is orphaned.", contextInfo,
                      storageKey, deleteFailure);
            cause.addSuppressed(deleteFailure);
        }
    }

    private StagedFile convertIfNeeded(Path spooled, IngestRequest request, String contextInfo) {
        final String fileName = spooled.getFileName().toString();
        try {
            final Optional<ConvertedFile> converted = conversionEngine.convert(spooled, fileName);
            if (converted.isPresent()) {
                final ConvertedFile file = converted.get();
                return new StagedFile(file.path(), file.fileName(), file.mimeType(), ConversionStatus.CONVERTED);
            }
            return new StagedFile(spooled, fileName, request.mimeType(), ConversionStatus.NOT_REQUIRED);
        } catch (FileConversionException e) {
            log.warn("[{}] Conversion failed; storing the original file. Cause: {}", contextInfo, e.getMessage());
            return new StagedFile(spooled, fileName, request.mimeType(), ConversionStatus.FAILED_ORIGINAL_KEPT);
        }
    }

    private void enqueueEnrichment(DocumentRecord record, String contextInfo) {
        final JobPayload payload = new JobPayload(record.getId(), record.getUserId(), record.getStorageKey(),
                                                  record.getMimeType());
        for (JobType type : new JobType[]{JobType.TEXT_EXTRACTION, JobType.THUMBNAIL}) {
            try {
                final String jobId = jobSubmitter.addJob(type, payload);
                log.debug("[{}] Queued {} job {}.", contextInfo, type, jobId);
            } catch (JobRejectedException e) {
                log.warn("[{}] Could not queue {} for document {}: {}", contextInfo, type, record.getId(),
                         e.getMessage());
            }
        }
    }

    // The caller owns the upload stream, so it is not closed here.
    private static long spool(InputStream content, Path target, MessageDigest digest) throws IOException {
        final DigestInputStream digestStream = new DigestInputStream(new BufferedInputStream(content), digest);
        return Files.copy(digestStream, target, StandardCopyOption.REPLACE_EXISTING);
    }

    private static String sha256Hex(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return DigestUtils.sha256Hex(in);
        }
    }

    private void cleanupWorkDir(Path workDir, String contextInfo) {
        if (workDir == null) {
            return;
        }
        try {
            FileUtils.deleteDirectory(workDir.toFile());
        } catch (IOException e) {
            log.warn("[{}] Failed to delete temporary directory {}", contextInfo, workDir, e);
        }
    }

    private record StagedFile(Path path, String fileName, String mimeType, ConversionStatus conversionStatus) {
    }
}
