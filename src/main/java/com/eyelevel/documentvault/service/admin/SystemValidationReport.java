package com.eyelevel.documentvault.service.admin;

import com.eyelevel.documentvault.model.EncryptionStats;
import com.eyelevel.documentvault.storage.StorageType;

import java.util.List;

/**
 * Outcome of an operator system check.
 *
 * @param warnings human-readable findings that need attention; empty when everything checks out.
 */
public record SystemValidationReport(boolean encryptionWorking, StorageType storageType, EncryptionStats stats,
                                     List<String> warnings) {

    public SystemValidationReport {
        warnings = List.copyOf(warnings);
    }

    public boolean isValid() {
        return encryptionWorking && warnings.isEmpty();
    }
}
