package com.eyelevel.documentvault.enrichment.text;

import java.io.IOException;

/**
 * Extracts plain text from document bytes.
 */
public interface TextExtractionEngine {

    boolean supports(String mimeType);

    String extractText(byte[] content, String mimeType) throws IOException;
}
