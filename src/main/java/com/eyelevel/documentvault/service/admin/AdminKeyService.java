package com.eyelevel.documentvault.service.admin;

import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.crypto.RotationResult;
import com.eyelevel.documentvault.exception.VaultException;
import com.eyelevel.documentvault.model.EncryptionStats;
import com.eyelevel.documentvault.service.metadata.MetadataStore;
import com.eyelevel.documentvault.storage.StorageProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator key management: master key generation, encryption self-test, master key rotation and a
 * system check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AdminKeyService {

    private final KeyManager keyManager;
    private final MetadataStore metadataStore;
    private final StorageProvider storageProvider;

    /**
     * @return a new 256-bit master key, hex-encoded. Nothing is stored.
     */
    public String generateMasterKey() {
        log.info("Generated a new master key. Store it in the secret manager before using it.");
        return KeyManager.generateMasterKey();
    }

    public boolean testEncryption() {
        boolean passed = keyManager.testEncryption();
        log.info("Encryption self-test {}.", passed ? "passed" : "FAILED");
        return passed;
    }

    /**
     * Re-wraps every stored document key from {@code oldMasterKey} to {@code newMasterKey} and persists the
     * re-wrapped keys. A record whose new key cannot be saved moves to the failed list and keeps its old key.
     *
     * <p>The running service keeps using the master key it was started with; restart it with the new key
     * once the result is complete.
     *
     * @throws com.eyelevel.documentvault.exception.ConfigurationException if either key is malformed.
     */
    public RotationResult rotateKeys(String oldMasterKey, String newMasterKey) {
        RotationResult rotated = keyManager.rotateDocumentKeys(oldMasterKey, newMasterKey,
                                                               metadataStore::findEncryptedKeys);

        List<RotationResult.RotatedKey> persisted = new ArrayList<>();
        List<RotationResult.RotationFailure> failed = new ArrayList<>(rotated.failed());
        for (RotationResult.RotatedKey key : rotated.succeeded()) {
            try {
                metadataStore.updateEncryptedKey(key.documentId(), key.newEncryptedDocumentKey());
                persisted.add(key);
            } catch (VaultException e) {
                log.error("Failed to save rotated key for document {}.", key.documentId(), e);
                failed.add(new RotationResult.RotationFailure(key.documentId(), "Persist failed: " + e.getMessage()));
            }
        }

        RotationResult result = new RotationResult(persisted, failed);
        if (result.isComplete()) {
            log.info("Rotated {} document key(s). Restart the service with the new master key.", persisted.size());
        } else {
            log.warn("Key rotation incomplete: {} rotated, {} failed. Documents {} still use the old master key.",
                     persisted.size(), failed.size(),
                     failed.stream().map(RotationResult.RotationFailure::documentId).toList());
        }
        return result;
    }

    public SystemValidationReport validateSystem() {
        boolean encryptionWorking = keyManager.testEncryption();
        EncryptionStats stats = metadataStore.getEncryptionStats();

        List<String> warnings = new ArrayList<>();
        if (!encryptionWorking) {
            warnings.add("Encryption self-test failed.");
        }
        if (stats.unencrypted() > 0) {
            warnings.add(stats.unencrypted() + " document(s) are stored without encryption.");
        }

        SystemValidationReport report = new SystemValidationReport(encryptionWorking,
                                                                   storageProvider.getStorageType(), stats, warnings);
        log.info("System validation: storage={}, documents={}, encrypted={}, unencrypted={}, warnings={}",
                 report.storageType(), stats.total(), stats.encrypted(), stats.unencrypted(), warnings.size());
        return report;
    }
}
