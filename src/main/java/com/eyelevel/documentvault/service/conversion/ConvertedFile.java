package com.eyelevel.documentvault.service.conversion;

import java.nio.file.Path;

/**
 * Output of a successful format conversion.
 */
public record ConvertedFile(Path path, String fileName, String mimeType) {
}
