package com.eyelevel.documentvault.service.conversion;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Normalizes uploads into a canonical format before they are encrypted.
 */
public interface ConversionEngine {

    /**
     * Converts {@code source} when its format needs normalization. The converted file is written next to
     * the source.
     *
     * @param source   the spooled upload.
     * @param fileName the original file name, used to decide whether conversion applies.
     *
     * @return the converted file, or empty when the format is kept as uploaded.
     *
     * @throws com.eyelevel.documentvault.exception.FileConversionException if conversion was attempted and failed.
     */
    Optional<ConvertedFile> convert(Path source, String fileName);
}
