package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.exception.ConfigurationException;
import com.eyelevel.documentvault.storage.StorageProvider;
import com.eyelevel.documentvault.storage.local.LocalStorageProvider;
import com.eyelevel.documentvault.storage.s3.S3StorageProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.transfer.s3.S3TransferManager;

import java.nio.file.Path;

/**
 * Selects the storage backend from {@code app.storage.type}. There is no automatic fallback between backends.
 */
@Slf4j
@Configuration
public class StorageConfig {

    @Bean
    public StorageProvider storageProvider(VaultProperties properties, ObjectProvider<S3Client> s3Client,
                                           ObjectProvider<S3Presigner> s3Presigner,
                                           ObjectProvider<S3TransferManager> transferManager) {
        VaultProperties.Storage storage = properties.getStorage();
        log.info("Using {} storage backend.", storage.getType());
        return switch (storage.getType()) {
            case LOCAL -> new LocalStorageProvider(Path.of(storage.getLocal().getBasePath()));
            case CLOUD -> {
                String bucketName = storage.getS3().getBucketName();
                if (!StringUtils.hasText(bucketName)) {
                    throw new ConfigurationException("app.storage.s3.bucket-name is required for cloud storage");
                }
                yield new S3StorageProvider(s3Client.getObject(), s3Presigner.getObject(), transferManager.getObject(),
                                            bucketName);
            }
        };
    }
}
