package com.eyelevel.documentvault;

import com.eyelevel.documentvault.config.VaultProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Document Vault Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app" properties to {@link VaultProperties}.</li>
 *     <li>{@link EnableScheduling}: Runs the rate limit eviction, worker health checks and finished job cleanup.</li>
 *     <li>{@link EnableRetry}: Retries office conversions.</li>
 *     <li>{@link EnableJpaRepositories}: Scans the document record and job record repositories.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.documentvault.repository")
@EnableConfigurationProperties(value = VaultProperties.class)
@EnableRetry
public class DocumentVaultApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting DocumentVaultApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(DocumentVaultApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "DocumentVault"));
        log.info("  - Storage:    {}", env.getProperty("app.storage.type", "local"));
        log.info("  - Job mode:   {}", env.getProperty("app.jobs.mode", "auto"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
