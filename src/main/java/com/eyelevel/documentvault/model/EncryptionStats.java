package com.eyelevel.documentvault.model;

/**
 * Counts of stored documents by encryption state.
 */
public record EncryptionStats(long total, long encrypted, long unencrypted) {
}
