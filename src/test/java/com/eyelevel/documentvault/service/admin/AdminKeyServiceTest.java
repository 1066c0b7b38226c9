package com.eyelevel.documentvault.service.admin;

import com.eyelevel.documentvault.crypto.EncryptedKeyRecord;
import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.crypto.RotationResult;
import com.eyelevel.documentvault.exception.ConfigurationException;
import com.eyelevel.documentvault.exception.MetadataStoreException;
import com.eyelevel.documentvault.model.DocumentRecord;
import com.eyelevel.documentvault.storage.StorageProvider;
import com.eyelevel.documentvault.storage.StorageType;
import com.eyelevel.documentvault.support.InMemoryMetadataStore;
import com.eyelevel.documentvault.support.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("AdminKeyService")
class AdminKeyServiceTest {

    @Mock
    private StorageProvider storageProvider;

    private KeyManager keyManager;
    private InMemoryMetadataStore metadataStore;
    private final List<byte[]> documentKeys = new ArrayList<>();

    @BeforeEach
    void setUp() {
        keyManager = new KeyManager(TestFixtures.MASTER_KEY);
        metadataStore = new InMemoryMetadataStore();
        when(storageProvider.getStorageType()).thenReturn(StorageType.CLOUD);
    }

    private AdminKeyService service() {
        return new AdminKeyService(keyManager, metadataStore, storageProvider);
    }

    private DocumentRecord storeEncrypted(String fileName) {
        byte[] documentKey = keyManager.generateDocumentKey();
        documentKeys.add(documentKey);
        return metadataStore.createDocument(DocumentRecord.builder().userId("u1").fileName(fileName)
                                                          .mimeType("application/pdf")
                                                          .storageKey("u1/" + fileName + "/" + fileName)
                                                          .storageType(StorageType.CLOUD).encrypted(true)
                                                          .encryptedDocumentKey(
                                                                  keyManager.encryptDocumentKey(documentKey))
                                                          .build());
    }

    @Nested
    @DisplayName("Key rotation")
    class KeyRotation {

        @Test
        @DisplayName("Should re-wrap every document key under the new master key")
        void rotatesAllKeys() {
            // Given
            DocumentRecord first = storeEncrypted("a.pdf");
            DocumentRecord second = storeEncrypted("b.pdf");

            // When
            RotationResult result = service().rotateKeys(TestFixtures.MASTER_KEY, TestFixtures.OTHER_MASTER_KEY);

            // Then
            assertThat(result.isComplete()).isTrue();
            assertThat(result.succeeded()).extracting(RotationResult.RotatedKey::documentId)
                                          .containsExactly(first.getId(), second.getId());
            KeyManager rotated = new KeyManager(TestFixtures.OTHER_MASTER_KEY);
            String storedKey = metadataStore.getDocument(first.getId()).orElseThrow().getEncryptedDocumentKey();
            assertThat(storedKey).isNotEqualTo(first.getEncryptedDocumentKey());
            assertThat(rotated.decryptDocumentKey(storedKey)).isEqualTo(documentKeys.get(0));
        }

        @Test
        @DisplayName("Should report every record as failed when the old key matches none of them")
        void wrongOldKeyFailsEveryRecordWithoutThrowing() {
            // Given
            DocumentRecord first = storeEncrypted("a.pdf");
            DocumentRecord second = storeEncrypted("b.pdf");
            DocumentRecord third = storeEncrypted("c.pdf");

            // When
            RotationResult result = service().rotateKeys(KeyManager.generateMasterKey(),
                                                         TestFixtures.OTHER_MASTER_KEY);

            // Then
            assertThat(result.succeeded()).isEmpty();
            assertThat(result.failed()).extracting(RotationResult.RotationFailure::documentId)
                                       .containsExactly(first.getId(), second.getId(), third.getId());
            assertThat(result.isComplete()).isFalse();
            assertThat(metadataStore.getDocument(second.getId()).orElseThrow().getEncryptedDocumentKey())
                    .isEqualTo(second.getEncryptedDocumentKey());
        }

        @Test
        void persistFailureMovesRecordToFailed() {
            DocumentRecord first = storeEncrypted("a.pdf");
            DocumentRecord second = storeEncrypted("b.pdf");
            InMemoryMetadataStore delegate = metadataStore;
            metadataStore = new InMemoryMetadataStore() {
                @Override
                public List<EncryptedKeyRecord> findEncryptedKeys() {
                    return delegate.findEncryptedKeys();
                }

                @Override
                public void updateEncryptedKey(Long documentId, String encryptedDocumentKey) {
                    if (documentId.equals(second.getId())) {
                        throw new MetadataStoreException("row locked");
                    }
                    delegate.updateEncryptedKey(documentId, encryptedDocumentKey);
                }
            };

            RotationResult result = service().rotateKeys(TestFixtures.MASTER_KEY, TestFixtures.OTHER_MASTER_KEY);

            assertThat(result.succeeded()).extracting(RotationResult.RotatedKey::documentId)
                                          .containsExactly(first.getId());
            assertThat(result.failed()).singleElement().satisfies(failure -> {
                assertThat(failure.documentId()).isEqualTo(second.getId());
                assertThat(failure.reason()).startsWith("Persist failed").contains("row locked");
            });
        }

        @Test
        void emptyStoreRotatesNothing() {
            RotationResult result = service().rotateKeys(TestFixtures.MASTER_KEY, TestFixtures.OTHER_MASTER_KEY);

            assertThat(result.total()).isZero();
            assertThat(result.isComplete()).isTrue();
        }

        @Test
        void malformedKeyIsAConfigurationError() {
            storeEncrypted("a.pdf");

            assertThatThrownBy(() -> service().rotateKeys("not-hex", TestFixtures.OTHER_MASTER_KEY))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Test
    void generatesDistinctHexMasterKeys() {
        String first = service().generateMasterKey();
        String second = service().generateMasterKey();

        assertThat(first).hasSize(64).matches("[0-9a-f]+");
        assertThat(first).isNotEqualTo(second);
    }

    @Test
    void selfTestPasses() {
        assertThat(service().testEncryption()).isTrue();
    }

    @Test
    @DisplayName("Should warn about documents stored without encryption")
    void validateSystemReportsUnencryptedDocuments() {
        storeEncrypted("a.pdf");
        metadataStore.createDocument(DocumentRecord.builder().userId("u1").fileName("plain.txt")
                                                   .mimeType("text/plain").storageKey("u1/p/plain.txt")
                                                   .storageType(StorageType.CLOUD).encrypted(false).build());

        SystemValidationReport report = service().validateSystem();

        assertThat(report.encryptionWorking()).isTrue();
        assertThat(report.storageType()).isEqualTo(StorageType.CLOUD);
        assertThat(report.stats().total()).isEqualTo(2);
        assertThat(report.stats().unencrypted()).isEqualTo(1);
        assertThat(report.warnings()).singleElement().asString().contains("without encryption");
        assertThat(report.isValid()).isFalse();
    }

    @Test
    void validateSystemPassesForFullyEncryptedStore() {
        storeEncrypted("a.pdf");

        assertThat(service().validateSystem().isValid()).isTrue();
    }
}
