package com.eyelevel.documentvault.enrichment.thumbnail;

import java.io.IOException;

/**
 * Renders a small PNG preview of a document.
 */
public interface ThumbnailRenderer {

    boolean supports(String mimeType);

    /**
     * @param width target width in pixels; height follows the source aspect ratio.
     */
    byte[] renderPng(byte[] content, String mimeType, int width) throws IOException;
}
