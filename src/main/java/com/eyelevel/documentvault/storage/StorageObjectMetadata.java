package com.eyelevel.documentvault.storage;

import java.time.Instant;

/**
 * Backend-reported facts about a stored object.
 *
 * @param etag entity tag if the backend provides one, otherwise {@code null}.
 */
public record StorageObjectMetadata(long size, String mimeType, Instant lastModified, String etag) {
}
