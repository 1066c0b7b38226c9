package com.eyelevel.documentvault.service;

import com.eyelevel.documentvault.crypto.EncryptedBytes;
import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.dto.DocumentAccess;
import com.eyelevel.documentvault.dto.IngestRequest;
import com.eyelevel.documentvault.enrichment.DocumentContentReader;
import com.eyelevel.documentvault.exception.RateLimitedException;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.model.AuthenticatedPrincipal;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.ratelimit.RateLimiter;
import com.eyelevel.documentvault.service.conversion.NoOpConversionEngine;
import com.eyelevel.documentvault.storage.StorageKeys;
import com.eyelevel.documentvault.storage.StorageProvider;
import com.eyelevel.documentvault.storage.StorageType;
import com.eyelevel.documentvault.storage.local.LocalStorageProvider;
import com.eyelevel.documentvault.support.InMemoryMetadataStore;
import com.eyelevel.documentvault.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DocumentAccessService")
class DocumentAccessServiceTest {

    private static final AuthenticatedPrincipal OWNER = TestFixtures.principal("owner", "household-1");
    private static final byte[] CONTENT = randomBytes(1000);

    @TempDir
    Path storageDir;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private JobSubmitter jobSubmitter;

    private KeyManager keyManager;
    private StorageProvider storageProvider;
    private InMemoryMetadataStore metadataStore;
    private DocumentAccessService accessService;

    @BeforeEach
    void setUp() {
        keyManager = new KeyManager(TestFixtures.MASTER_KEY, 256);
        storageProvider = new LocalStorageProvider(storageDir);
        metadataStore = new InMemoryMetadataStore();
        when(rateLimiter.allow(anyString())).thenReturn(true);
        accessService = accessService(storageProvider);
    }

    private DocumentAccessService accessService(StorageProvider provider) {
        return new DocumentAccessService(metadataStore, provider,
                                         new DocumentContentReader(provider, keyManager, TestFixtures.jsonParser()),
                                         rateLimiter, new DocumentDeletionService(metadataStore, provider), 900);
    }

    private DocumentRecord upload(boolean encrypted) {
        DocumentIngestionService ingestion = new DocumentIngestionService(
                rateLimiter, new ValidationService(1_000_000), new NoOpConversionEngine(), keyManager, storageProvider,
                metadataStore, jobSubmitter, TestFixtures.jsonSerializer(), encrypted);
        return ingestion.ingest(OWNER, new IngestRequest("scan.bin", "application/octet-stream",
                                                         new ByteArrayInputStream(CONTENT)));
    }

    private static byte[] readAll(DocumentAccess access) throws IOException {
        try (InputStream in = access.getContent()) {
            return in.readAllBytes();
        }
    }

    private static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        new Random(7).nextBytes(bytes);
        return bytes;
    }

    @Nested
    @DisplayName("Document reads")
    class DocumentReads {

        @Test
        @DisplayName("Should proxy the decrypted plaintext of an encrypted document")
        void proxiesEncryptedDocument() throws IOException {
            DocumentRecord record = upload(true);

            DocumentAccess access = accessService.openDocument(OWNER, record.getId());

            assertThat(access.getKind()).isEqualTo(DocumentAccess.Kind.CONTENT);
            assertThat(access.getContentLength()).isEqualTo(CONTENT.length);
            assertThat(access.getMimeType()).isEqualTo("application/octet-stream");
            assertThat(readAll(access)).isEqualTo(CONTENT);
        }

        @Test
        void householdMemberCanRead() throws IOException {
            DocumentRecord record = upload(true);

            DocumentAccess access = accessService.openDocument(TestFixtures.principal("spouse", "household-1"),
                                                               record.getId());

            assertThat(readAll(access)).isEqualTo(CONTENT);
        }

        @Test
        @DisplayName("Should report a document owned by someone else as not found")
        void strangerSeesNotFound() {
            DocumentRecord record = upload(true);

            DocumentAccess access = accessService.openDocument(TestFixtures.principal("stranger", "household-2"),
                                                               record.getId());

            assertThat(access.isFound()).isFalse();
            assertThat(metadataStore.getDocument(record.getId())).isPresent();
        }

        @Test
        void unknownDocumentIsNotFound() {
            assertThat(accessService.openDocument(OWNER, 999L).getKind()).isEqualTo(DocumentAccess.Kind.NOT_FOUND);
        }

        @Test
        void proxiesUnencryptedDocumentWhenSigningIsUnsupported() throws IOException {
            DocumentRecord record = upload(false);

            DocumentAccess access = accessService.openDocument(OWNER, record.getId());

            assertThat(access.getKind()).isEqualTo(DocumentAccess.Kind.CONTENT);
            assertThat(readAll(access)).isEqualTo(CONTENT);
        }

        @Test
        @DisplayName("Should redirect unencrypted documents to a signed URL when the backend can sign")
        void redirectsUnencryptedDocument() throws Exception {
            // Given
            DocumentRecord record = upload(false);
            StorageProvider signing = mock(StorageProvider.class);
            URL signedUrl = new URL("https://bucket.example.com/" + record.getStorageKey() + "?sig=abc");
            when(signing.exists(record.getStorageKey())).thenReturn(true);
            when(signing.getSignedUrl(record.getStorageKey(), 900)).thenReturn(signedUrl);
            when(signing.getStorageType()).thenReturn(StorageType.CLOUD);

            // When
            DocumentAccess access = accessService(signing).openDocument(OWNER, record.getId());

            // Then
            assertThat(access.getKind()).isEqualTo(DocumentAccess.Kind.REDIRECT);
            assertThat(access.getRedirectUrl()).isEqualTo(signedUrl);
            assertThat(access.getContent()).isNull();
        }
    }

    @Nested
    @DisplayName("Range reads")
    class RangeReads {

        @Test
        @DisplayName("Should return exactly the requested plaintext range across chunk boundaries")
        void readsEncryptedRange() throws IOException {
            DocumentRecord record = upload(true);

            DocumentAccess access = accessService.openRange(OWNER, record.getId(), 200, 400);

            assertThat(access.getContentLength()).isEqualTo(400);
            assertThat(readAll(access)).isEqualTo(Arrays.copyOfRange(CONTENT, 200, 600));
        }

        @Test
        void clampsRangeToDocumentEnd() throws IOException {
            DocumentRecord record = upload(true);

            DocumentAccess access = accessService.openRange(OWNER, record.getId(), 900, 500);

            assertThat(access.getContentLength()).isEqualTo(100);
            assertThat(readAll(access)).isEqualTo(Arrays.copyOfRange(CONTENT, 900, 1000));
        }

        @Test
        void readsUnencryptedRange() throws IOException {
            DocumentRecord record = upload(false);

            DocumentAccess access = accessService.openRange(OWNER, record.getId(), 10, 20);

            assertThat(readAll(access)).isEqualTo(Arrays.copyOfRange(CONTENT, 10, 30));
        }

        @Test
        void rejectsInvalidRanges() {
            DocumentRecord record = upload(true);

            assertThatThrownBy(() -> accessService.openRange(OWNER, record.getId(), -1, 10))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> accessService.openRange(OWNER, record.getId(), 1001, 10))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Orphaned records")
    class OrphanedRecords {

        @Test
        @DisplayName("Should delete a record whose stored object is gone and report not found")
        void healsOrphanedRecord() {
            // Given
            DocumentRecord record = upload(true);
            storageProvider.delete(record.getStorageKey());

            // When
            DocumentAccess access = accessService.openDocument(OWNER, record.getId());

            // Then
            assertThat(access.isFound()).isFalse();
            assertThat(metadataStore.getDocument(record.getId())).isEmpty();
        }

        @Test
        void healsOrphanOnRangeRead() {
            DocumentRecord record = upload(false);
            storageProvider.delete(record.getStorageKey());

            assertThat(accessService.openRange(OWNER, record.getId(), 0, 10).isFound()).isFalse();
            assertThat(metadataStore.size()).isZero();
        }
    }

    @Nested
    @DisplayName("Thumbnails")
    class Thumbnails {

        private final byte[] png = randomBytes(300);

        private DocumentRecord withEncryptedThumbnail() {
            DocumentRecord record = upload(true);
            byte[] documentKey = keyManager.decryptDocumentKey(record.getEncryptedDocumentKey());
            EncryptedBytes encrypted = keyManager.encryptBytes(png, documentKey);
            String thumbnailKey = StorageKeys.forThumbnail(record.getStorageKey());
            storageProvider.upload(encrypted.ciphertext(), thumbnailKey, "image/png");
            String metadata = TestFixtures.jsonSerializer().serialize(encrypted.metadata());
            return metadataStore.updateDocument(record.getId(), current -> {
                current.setThumbnailKey(thumbnailKey);
                current.setThumbnailCipherMetadata(metadata);
            }).orElseThrow();
        }

        @Test
        void servesDecryptedThumbnail() throws IOException {
            DocumentRecord record = withEncryptedThumbnail();

            DocumentAccess access = accessService.openThumbnail(OWNER, record.getId());

            assertThat(access.getMimeType()).isEqualTo("image/png");
            assertThat(access.getContentLength()).isEqualTo(png.length);
            assertThat(readAll(access)).isEqualTo(png);
        }

        @Test
        void missingThumbnailIsNotFound() {
            DocumentRecord record = upload(true);

            assertThat(accessService.openThumbnail(OWNER, record.getId()).isFound()).isFalse();
        }

        @Test
        @DisplayName("Should clear the thumbnail reference when the thumbnail object is gone")
        void clearsOrphanedThumbnail() {
            DocumentRecord record = withEncryptedThumbnail();
            storageProvider.delete(record.getThumbnailKey());

            DocumentAccess access = accessService.openThumbnail(OWNER, record.getId());

            assertThat(access.isFound()).isFalse();
            DocumentRecord reloaded = metadataStore.getDocument(record.getId()).orElseThrow();
            assertThat(reloaded.getThumbnailKey()).isNull();
            assertThat(reloaded.getThumbnailCipherMetadata()).isNull();
        }

        @Test
        void thumbnailReadsAreRateLimited() {
            DocumentRecord record = withEncryptedThumbnail();
            when(rateLimiter.allow("owner")).thenReturn(false);

            assertThatThrownBy(() -> accessService.openThumbnail(OWNER, record.getId()))
                    .isInstanceOf(RateLimitedException.class);
        }
    }
}
