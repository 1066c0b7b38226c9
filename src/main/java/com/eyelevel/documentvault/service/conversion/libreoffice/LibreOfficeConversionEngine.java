package com.eyelevel.documentvault.service.conversion.libreoffice;

import com.eyelevel.documentvault.exception.FileConversionException;
import com.eyelevel.documentvault.service.conversion.ConversionEngine;
import com.eyelevel.documentvault.service.conversion.ConvertedFile;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.jodconverter.core.office.OfficeException;
import org.jodconverter.core.office.OfficeManager;
import org.jodconverter.local.LocalConverter;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Converts office formats to PDF through the managed LibreOffice process. Extensions outside the
 * configured set are stored unchanged.
 *
 * <p>A failed conversion is retried with a fixed delay; once the attempts are used up the upload is
 * rejected with a {@link FileConversionException}.
 */
@Slf4j
public class LibreOfficeConversionEngine implements ConversionEngine {

    private static final String PDF_MIME_TYPE = "application/pdf";

    private final OfficeManager officeManager;
    private final Set<String> convertibleExtensions;

    public LibreOfficeConversionEngine(OfficeManager officeManager, Set<String> convertibleExtensions) {
        this.officeManager = officeManager;
        this.convertibleExtensions = convertibleExtensions.stream().map(ext -> ext.toLowerCase(Locale.ROOT))
                                                          .collect(Collectors.toUnmodifiableSet());
        log.info("LibreOffice conversion enabled for extensions: {}", this.convertibleExtensions);
    }

    @Override
    @Retryable(retryFor = FileConversionException.class,
               maxAttemptsExpression = "#{${app.conversion.retry.attempts} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.conversion.retry.delay-ms}}"),
               listeners = {"conversionRetryListener"})
    public Optional<ConvertedFile> convert(Path source, String fileName) {
        String extension = FilenameUtils.getExtension(fileName).toLowerCase(Locale.ROOT);
        if (!convertibleExtensions.contains(extension)) {
            return Optional.empty();
        }
        String convertedName = FilenameUtils.getBaseName(fileName) + ".pdf";
        Path target = targetFor(source);
        log.info("Converting upload '{}' to PDF.", fileName);

        try {
            Files.deleteIfExists(target);
            LocalConverter.make(officeManager).convert(source.toFile()).to(target.toFile()).execute();
            if (!Files.exists(target) || Files.size(target) == 0) {
                throw new FileConversionException("Conversion of '" + fileName + "' produced no output");
            }
        } catch (OfficeException e) {
            throw new FileConversionException("LibreOffice could not convert '" + fileName + "'", e);
        } catch (IOException e) {
            throw new FileConversionException("Could not prepare conversion output for '" + fileName + "'", e);
        }
        log.info("Converted '{}' to '{}'.", fileName, convertedName);
        return Optional.of(new ConvertedFile(target, convertedName, PDF_MIME_TYPE));
    }

    @Recover
    public Optional<ConvertedFile> recover(FileConversionException e, Path source, String fileName) {
        log.error("Giving up on converting '{}' after all retry attempts.", fileName, e);
        throw new FileConversionException("Conversion of '" + fileName + "' failed after all retry attempts", e);
    }

    static Path targetFor(Path source) {
        return source.resolveSibling(FilenameUtils.getBaseName(source.getFileName().toString()) + ".converted.pdf");
    }
}
