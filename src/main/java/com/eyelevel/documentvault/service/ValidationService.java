package com.eyelevel.documentvault.service;

import com.eyelevel.documentvault.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * A centralized, stateless service for performing validation checks on uploads.
 */
@Slf4j
@Service
public class ValidationService {

    private final long maxFileSizeBytes;

    public ValidationService(@Value("${app.processing.max-file-size-bytes:104857600}") long maxFileSizeBytes) {
        this.maxFileSizeBytes = maxFileSizeBytes;
    }

    /**
     * Checks that an upload name is usable. Runs before any content is read.
     *
     * @param fileName The name of the file, which may include path information.
     *
     * @throws ValidationException if the name is empty or refers to a hidden file.
     */
    public void validateFileName(final String fileName) {
        log.trace("Validating file name '{}'.", fileName);

        final String baseName = FilenameUtils.getName(fileName);

        if (!StringUtils.hasText(baseName) || baseName.trim().equals(".")) {
            throw new ValidationException("File has an invalid or empty name.");
        }

        if (baseName.startsWith(".")) {
            throw new ValidationException("File is a hidden file and will be ignored.");
        }
    }

    /**
     * Performs the name checks plus the size checks once the content length is known.
     *
     * @param fileName The name of the file, which may include path information.
     * @param fileSize The size of the file in bytes.
     *
     * @throws ValidationException if the upload is not eligible for storage.
     */
    public void validateFile(final String fileName, final long fileSize) {
        validateFileName(fileName);

        if (fileSize <= 0) {
            throw new ValidationException("File is empty or has an invalid size.");
        }

        if (fileSize > maxFileSizeBytes) {
            throw new ValidationException(
                    String.format("File is %d bytes, which exceeds the %d byte limit.", fileSize, maxFileSizeBytes));
        }

        log.trace("File '{}' passed all validation checks.", fileName);
    }
}
