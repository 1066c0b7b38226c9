package com.eyelevel.documentvault.service;

import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.dto.IngestRequest;
import com.eyelevel.documentvault.enrichment.DocumentContentReader;
import com.eyelevel.documentvault.exception.FileConversionException;
import com.eyelevel.documentvault.exception.JobRejectedException;
import com.eyelevel.documentvault.exception.MetadataStoreException;
import com.eyelevel.documentvault.exception.RateLimitedException;
import com.eyelevel.documentvault.exception.StorageException;
import com.eyelevel.documentvault.exception.ValidationException;
import com.eyelevel.documentvault.job.JobPayload;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.JobType;
import com.eyelevel.documentvault.model.ConversionStatus;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.ratelimit.RateLimiter;
import com.eyelevel.documentvault.service.conversion.ConversionEngine;
import com.eyelevel.documentvault.service.conversion.ConvertedFile;
import com.eyelevel.documentvault.service.conversion.NoOpConversionEngine;
import com.eyelevel.documentvault.storage.StorageProvider;
import com.eyelevel.documentvault.storage.StorageType;
import com.eyelevel.documentvault.storage.local.LocalStorageProvider;
import com.eyelevel.documentvault.support.InMemoryMetadataStore;
import com.eyelevel.documentvault.support.TestFixtures;
import org.apache.commons.codec.digest.DigestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("DocumentIngestionService")
class DocumentIngestionServiceTest {

    @TempDir
    Path storageDir;

    @Mock
    private RateLimiter rateLimiter;

    @Mock
    private JobSubmitter jobSubmitter;

    private KeyManager keyManager;
    private StorageProvider storageProvider;
    private InMemoryMetadataStore metadataStore;
    private DocumentContentReader contentReader;

    @BeforeEach
    void setUp() {
        keyManager = new KeyManager(TestFixtures.MASTER_KEY, 256);
        storageProvider = spy(new LocalStorageProvider(storageDir));
        metadataStore = new InMemoryMetadataStore();
        contentReader = new DocumentContentReader(storageProvider, keyManager, TestFixtures.jsonParser());
        when(rateLimiter.allow(anyString())).thenReturn(true);
        when(jobSubmitter.addJob(any(JobType.class), any(JobPayload.class))).thenReturn("job-id");
    }

    private DocumentIngestionService service(ConversionEngine conversionEngine, boolean encryptionEnabled) {
        return new DocumentIngestionService(rateLimiter, new ValidationService(10_000), conversionEngine, keyManager,
                                            storageProvider, metadataStore, jobSubmitter,
                                            TestFixtures.jsonSerializer(), encryptionEnabled);
    }

    private DocumentIngestionService service() {
        return service(new NoOpConversionEngine(), true);
    }

    private static IngestRequest request(String fileName, String mimeType, byte[] content) {
        return new IngestRequest(fileName, mimeType, new ByteArrayInputStream(content));
    }

    private static byte[] randomBytes(int size) {
        byte[] bytes = new byte[size];
        new Random(42).nextBytes(bytes);
        return bytes;
    }

    @Nested
    @DisplayName("Successful uploads")
    class SuccessfulUploads {

        @Test
        @DisplayName("Should store a 2KB upload encrypted and queue its enrichment")
        void storesEncryptedDocument() throws Exception {
            // Given
            byte[] content = randomBytes(2048);

            // When
            DocumentRecord record = service().ingest(TestFixtures.principal("user-u"),
                                                     request("statement.txt", "text/plain", content));

            // Then
            assertThat(record.getId()).isNotNull();
            assertThat(record.isEncrypted()).isTrue();
            assertThat(record.getUserId()).isEqualTo("user-u");
            assertThat(record.getFileSize()).isEqualTo(2048);
            assertThat(record.getContentHash()).isEqualTo(DigestUtils.sha256Hex(content));
            assertThat(record.getStorageType()).isEqualTo(StorageType.LOCAL);
            assertThat(record.getConversionStatus()).isEqualTo(ConversionStatus.NOT_REQUIRED);
            assertThat(record.getStorageKey()).startsWith("user-u/").endsWith("/statement.txt");
            assertThat(record.getEncryptedDocumentKey()).isNotBlank();
            assertThat(record.getEncryptionMetadata()).contains(KeyManager.FILE_ALGORITHM);

            byte[] stored = Files.readAllBytes(storageDir.resolve(record.getStorageKey()));
            assertThat(stored).isNotEqualTo(content);
            assertThat(contentReader.readPlaintext(record)).isEqualTo(content);

            ArgumentCaptor<JobPayload> payload = ArgumentCaptor.forClass(JobPayload.class);
            verify(jobSubmitter).addJob(eq(JobType.TEXT_EXTRACTION), payload.capture());
            verify(jobSubmitter).addJob(eq(JobType.THUMBNAIL), any(JobPayload.class));
            assertThat(payload.getValue().documentId()).isEqualTo(record.getId());
            assertThat(payload.getValue().storageKey()).isEqualTo(record.getStorageKey());
        }

        @Test
        @DisplayName("Should give identical file names from different users distinct storage keys")
        void sameNameDifferentUsers() {
            byte[] content = "same bytes".getBytes(StandardCharsets.UTF_8);

            DocumentRecord first = service().ingest(TestFixtures.principal("alice"),
                                                    request("report.pdf", "application/pdf", content));
            DocumentRecord second = service().ingest(TestFixtures.principal("bob"),
                                                     request("report.pdf", "application/pdf", content));
            DocumentRecord third = service().ingest(TestFixtures.principal("alice"),
                                                    request("report.pdf", "application/pdf", content));

            assertThat(first.getStorageKey()).isNotEqualTo(second.getStorageKey())
                                             .isNotEqualTo(third.getStorageKey());
            assertThat(metadataStore.size()).isEqualTo(3);
        }

        @Test
        void storesPlaintextWhenEncryptionDisabled() throws Exception {
            byte[] content = "plain statement".getBytes(StandardCharsets.UTF_8);

            DocumentRecord record = service(new NoOpConversionEngine(), false)
                    .ingest(TestFixtures.principal("user-u"), request("plain.txt", "text/plain", content));

            assertThat(record.isEncrypted()).isFalse();
            assertThat(record.getEncryptedDocumentKey()).isNull();
            assertThat(record.getCipherMetadata()).isNull();
            assertThat(Files.readAllBytes(storageDir.resolve(record.getStorageKey()))).isEqualTo(content);
        }

        @Test
        @DisplayName("Should store the converted file and hash the converted bytes")
        void storesConvertedFile() throws Exception {
            // Given
            byte[] pdfBytes = "%PDF-1.7 converted".getBytes(StandardCharsets.UTF_8);
            ConversionEngine converter = mock(ConversionEngine.class);
            when(converter.convert(any(Path.class), eq("letter.docx"))).thenAnswer(invocation -> {
                Path source = invocation.getArgument(0);
                Path target = source.resolveSibling("letter.converted.pdf");
                Files.write(target, pdfBytes);
                return Optional.of(new ConvertedFile(target, "letter.pdf", "application/pdf"));
            });

            // When
            DocumentRecord record = service(converter, true).ingest(
                    TestFixtures.principal("user-u"),
                    request("letter.docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
                            "docx bytes".getBytes(StandardCharsets.UTF_8)));

            // Then
            assertThat(record.getConversionStatus()).isEqualTo(ConversionStatus.CONVERTED);
            assertThat(record.getMimeType()).isEqualTo("application/pdf");
            assertThat(record.getFileName()).isEqualTo("letter.pdf");
            assertThat(record.getStorageKey()).endsWith("/letter.pdf");
            assertThat(record.getContentHash()).isEqualTo(DigestUtils.sha256Hex(pdfBytes));
            assertThat(contentReader.readPlaintext(record)).isEqualTo(pdfBytes);
        }

        @Test
        @DisplayName("Should keep the original file when conversion fails")
        void conversionFailureIsNotFatal() {
            ConversionEngine converter = mock(ConversionEngine.class);
            when(converter.convert(any(Path.class), anyString()))
                    .thenThrow(new FileConversionException("office crashed"));
            byte[] content = "docx bytes".getBytes(StandardCharsets.UTF_8);

            DocumentRecord record = service(converter, true)
                    .ingest(TestFixtures.principal("user-u"), request("letter.docx", "application/msword", content));

            assertThat(record.getConversionStatus()).isEqualTo(ConversionStatus.FAILED_ORIGINAL_KEPT);
            assertThat(record.getMimeType()).isEqualTo("application/msword");
            assertThat(contentReader.readPlaintext(record)).isEqualTo(content);
        }

        @Test
        void rejectedEnrichmentDoesNotFailUpload() {
            when(jobSubmitter.addJob(any(JobType.class), any(JobPayload.class)))
                    .thenThrow(new JobRejectedException("queue full"));

            DocumentRecord record = service().ingest(TestFixtures.principal("user-u"),
                                                     request("a.txt", "text/plain", randomBytes(64)));

            assertThat(metadataStore.getDocument(record.getId())).isPresent();
            verify(jobSubmitter, times(2)).addJob(any(JobType.class), any(JobPayload.class));
        }
    }

    @Nested
    @DisplayName("Rejected uploads")
    class RejectedUploads {

        @Test
        void rateLimitedBeforeAnyWork() {
            when(rateLimiter.allow("user-u")).thenReturn(false);

            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request("a.txt", "text/plain", randomBytes(10))))
                    .isInstanceOf(RateLimitedException.class);

            verify(storageProvider, never()).uploadFile(any(Path.class), anyString(), anyString());
            assertThat(metadataStore.size()).isZero();
        }

        @Test
        void rejectsEmptyUpload() {
            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request("a.txt", "text/plain", new byte[0])))
                    .isInstanceOf(ValidationException.class);

            assertThat(metadataStore.size()).isZero();
        }

        @Test
        void rejectsOversizedUpload() {
            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request("big.bin", "application/octet-stream",
                                                              randomBytes(10_001))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("exceeds");
        }

        @Test
        void rejectsHiddenFileName() {
            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request(".env", "text/plain", randomBytes(10))))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("Failure handling")
    class FailureHandling {

        @Test
        @DisplayName("Should create no record when the upload fails")
        void uploadFailureLeavesNoRecord() {
            doThrow(new StorageException("disk full")).when(storageProvider)
                                                      .uploadFile(any(Path.class), anyString(), anyString());

            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request("a.txt", "text/plain", randomBytes(100))))
                    .isInstanceOf(StorageException.class)
                    .hasMessageContaining("disk full");

            assertThat(metadataStore.size()).isZero();
            verifyNoInteractions(jobSubmitter);
        }

        @Test
        @DisplayName("Should delete the stored object when the record cannot be created")
        void recordFailureRemovesStoredObject() throws Exception {
            // Given
            InMemoryMetadataStore failingStore = new InMemoryMetadataStore() {
                @Override
                public DocumentRecord createDocument(DocumentRecord record) {
                    throw new MetadataStoreException("database down");
                }
            };
            metadataStore = failingStore;

            // When / Then
            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request("a.txt", "text/plain", randomBytes(100))))
                    .isInstanceOf(MetadataStoreException.class)
                    .hasMessageContaining("database down");

            ArgumentCaptor<String> deletedKey = ArgumentCaptor.forClass(String.class);
            verify(storageProvider).delete(deletedKey.capture());
            assertThat(storageProvider.exists(deletedKey.getValue())).isFalse();
            try (var files = Files.walk(storageDir)) {
                assertThat(files.filter(Files::isRegularFile)).isEmpty();
            }
            verifyNoInteractions(jobSubmitter);
        }

        @Test
        void failedCompensationIsAttachedToTheError() {
            metadataStore = new InMemoryMetadataStore() {
                @Override
                public DocumentRecord createDocument(DocumentRecord record) {
                    throw new IllegalStateException("constraint violated");
                }
            };
            doThrow(new StorageException("delete refused")).when(storageProvider).delete(anyString());

            assertThatThrownBy(() -> service().ingest(TestFixtures.principal("user-u"),
                                                      request("a.txt", "text/plain", randomBytes(100))))
                    .isInstanceOf(MetadataStoreException.class)
                    .hasRootCauseMessage("constraint violated")
                    .satisfies(e -> assertThat(Arrays.stream(e.getCause().getSuppressed())
                                                     .map(Throwable::getMessage))
                            .containsExactly("delete refused"));
        }
    }
}
