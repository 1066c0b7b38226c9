package com.eyelevel.documentvault.service.conversion;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Used when office conversion is switched off; every upload is stored as received.
 */
@Slf4j
public class NoOpConversionEngine implements ConversionEngine {

    @Override
    public Optional<ConvertedFile> convert(Path source, String fileName) {
        log.trace("Conversion disabled; keeping '{}' as uploaded.", fileName);
        return Optional.empty();
    }
}
