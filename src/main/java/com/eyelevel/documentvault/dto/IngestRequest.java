package com.eyelevel.documentvault.dto;

import java.io.InputStream;

/**
 * An upload handed to the ingestion pipeline. The pipeline reads {@code content} once and does not close it.
 */
public record IngestRequest(String fileName, String mimeType, InputStream content) {
}
