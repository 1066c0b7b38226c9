package com.eyelevel.documentvault.service.conversion.libreoffice;

import com.eyelevel.documentvault.exception.FileConversionException;
import com.eyelevel.documentvault.service.conversion.ConversionEngine;
import org.jodconverter.core.office.OfficeException;
import org.jodconverter.core.office.OfficeManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

/**
 * Runs the engine behind the retry proxy to check the retry and recovery wiring.
 */
@SpringJUnitConfig(LibreOfficeConversionRetryTest.RetryTestConfig.class)
@TestPropertySource(properties = {"app.conversion.retry.attempts=2", "app.conversion.retry.delay-ms=1"})
@DisplayName("LibreOfficeConversionEngine retries")
class LibreOfficeConversionRetryTest {

    @Configuration
    @EnableRetry
    static class RetryTestConfig {

        @Bean
        OfficeManager officeManager() {
            return mock(OfficeManager.class);
        }

        @Bean
        ConversionRetryListener conversionRetryListener() {
            return new ConversionRetryListener();
        }

        @Bean
        ConversionEngine conversionEngine(OfficeManager officeManager) {
            return new LibreOfficeConversionEngine(officeManager, Set.of("docx"));
        }
    }

    @TempDir
    Path workDir;

    @Autowired
    private ConversionEngine engine;

    @Autowired
    private OfficeManager officeManager;

    @BeforeEach
    void setUp() {
        reset(officeManager);
    }

    @Test
    @DisplayName("Should succeed when LibreOffice recovers before the attempts run out")
    void retriesTransientFailures() throws Exception {
        // Given
        Path source = Files.writeString(workDir.resolve("minutes.docx"), "office bytes");
        doThrow(new OfficeException("process restarting"))
                .doThrow(new OfficeException("process restarting"))
                .doAnswer(LibreOfficeConversionEngineTest.writesPdfFor(source))
                .when(officeManager).execute(any());

        // When / Then
        assertThat(engine.convert(source, "minutes.docx")).hasValueSatisfying(
                file -> assertThat(file.fileName()).isEqualTo("minutes.pdf"));
        verify(officeManager, times(3)).execute(any());
    }

    @Test
    @DisplayName("Should reject the upload once every attempt has failed")
    void givesUpAfterLastAttempt() throws Exception {
        // Given
        Path source = Files.writeString(workDir.resolve("minutes.docx"), "office bytes");
        doThrow(new OfficeException("soffice crashed")).when(officeManager).execute(any());

        // When / Then
        assertThatThrownBy(() -> engine.convert(source, "minutes.docx"))
                .isInstanceOf(FileConversionException.class)
                .hasMessageContaining("after all retry attempts")
                .hasRootCauseInstanceOf(OfficeException.class);
        verify(officeManager, times(3)).execute(any());
    }
}
