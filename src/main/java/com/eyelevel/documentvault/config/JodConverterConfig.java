package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.service.conversion.ConversionEngine;
import com.eyelevel.documentvault.service.conversion.NoOpConversionEngine;
import com.eyelevel.documentvault.service.conversion.libreoffice.LibreOfficeConversionEngine;
import org.jodconverter.local.office.LocalOfficeManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configures upload conversion. With {@code app.conversion.enabled} a local LibreOffice instance is
 * started and managed by the application; otherwise uploads are stored as received.
 */
@Configuration
public class JodConverterConfig {

    /**
     * Creates and starts a {@link LocalOfficeManager} controlling the LibreOffice process.
     */
    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "app.conversion.enabled", havingValue = "true")
    public LocalOfficeManager localOfficeManager(VaultProperties properties) {
        VaultProperties.Conversion.Office office = properties.getConversion().getOffice();
        return LocalOfficeManager.builder().officeHome(office.getHome()).portNumbers(office.getPortNumbers())
                                 .taskExecutionTimeout(office.getTaskExecutionTimeout()).build();
    }

    @Bean
    @ConditionalOnProperty(name = "app.conversion.enabled", havingValue = "true")
    public ConversionEngine libreOfficeConversionEngine(LocalOfficeManager officeManager,
                                                        VaultProperties properties) {
        return new LibreOfficeConversionEngine(officeManager, properties.getConversion().getConvertibleExtensions());
    }

    @Bean
    @ConditionalOnProperty(name = "app.conversion.enabled", havingValue = "false", matchIfMissing = true)
    public ConversionEngine noOpConversionEngine() {
        return new NoOpConversionEngine();
    }
}
