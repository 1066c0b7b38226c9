package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.crypto.KeyManager;
import com.eyelevel.documentvault.exception.ConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;

/**
 * Creates the {@link KeyManager}. A missing or malformed master key stops the application from starting.
 */
@Slf4j
@Configuration
public class EncryptionConfig {

    @Bean
    public KeyManager keyManager(VaultProperties properties) {
        VaultProperties.Encryption encryption = properties.getEncryption();
        if (!StringUtils.hasText(encryption.getMasterKey())) {
            throw new ConfigurationException(
                    "No master key configured. Set app.encryption.master-key (DOCUMENT_MASTER_KEY) to 64 hex "
                    + "characters; generate one with AdminKeyService.generateMasterKey().");
        }

        KeyManager keyManager = new KeyManager(encryption.getMasterKey(), encryption.getChunkSize());
        if (encryption.isSelfTestOnStartup()) {
            if (!keyManager.testEncryption()) {
                throw new ConfigurationException("Encryption self-test failed at startup");
            }
            log.info("Encryption self-test passed.");
        }
        if (!encryption.isEnabled()) {
            log.warn("Encryption of new uploads is DISABLED. Documents will be stored in plaintext.");
        }
        return keyManager;
    }
}
