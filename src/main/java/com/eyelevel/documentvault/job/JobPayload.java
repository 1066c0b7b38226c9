package com.eyelevel.documentvault.job;

/**
 * What a job works on. Handlers reload the document record by id, so the payload only carries
 * identifiers and routing hints.
 */
public record JobPayload(Long documentId, String userId, String storageKey, String mimeType) {
}
