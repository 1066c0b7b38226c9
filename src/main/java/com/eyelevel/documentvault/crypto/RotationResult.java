package com.eyelevel.documentvault.crypto;

import java.util.List;

/**
 * Per-record outcome of a master key rotation.
 *
 * <p>A record appears in exactly one of the two lists. Records in {@code succeeded} carry the
 * document key re-wrapped under the new master key; records in {@code failed} were left untouched.
 */
public record RotationResult(List<RotatedKey> succeeded, List<RotationFailure> failed) {

    public RotationResult {
        succeeded = List.copyOf(succeeded);
        failed = List.copyOf(failed);
    }

    public int total() {
        return succeeded.size() + failed.size();
    }

    public boolean isComplete() {
        return failed.isEmpty();
    }

    public record RotatedKey(Long documentId, String newEncryptedDocumentKey) {
    }

    public record RotationFailure(Long documentId, String reason) {
    }
}
