package com.eyelevel.documentvault.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryMode;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.crt.S3CrtRetryConfiguration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;
import software.amazon.awssdk.transfer.s3.S3TransferManager;

import java.time.Duration;

/**
 * Configures and provides AWS SDK client beans for S3 and SQS.
 *
 * <p>Building the clients does not contact AWS, so they are always present; only the cloud storage
 * backend, the dead-letter publisher and the queue backend check use them.
 */
@Slf4j
@Configuration
public class AwsConfig {

    @Value("${aws.region}")
    private String awsRegion;

    @Value("${aws.access-key:}")
    private String accessKey;

    @Value("${aws.secret-key:}")
    private String secretKey;

    @Value("${aws.s3.retry-count}")
    private int s3RetryCount;

    @Value("${aws.s3.api-call-timeout}")
    private Duration apiCallTimeout;

    /**
     * Static credentials when both keys are configured, otherwise the default chain (IAM role, env vars).
     */
    @Bean
    public AwsCredentialsProvider awsCredentialsProvider() {
        if (StringUtils.hasText(accessKey) && StringUtils.hasText(secretKey)) {
            log.info("AWS access keys configured. Using StaticCredentialsProvider.");
            return StaticCredentialsProvider.create(AwsBasicCredentials.create(accessKey, secretKey));
        }
        log.info("No AWS access keys configured. Using DefaultCredentialsProvider.");
        return DefaultCredentialsProvider.create();
    }

    /**
     * Adaptive retries plus a hard per-call timeout, shared by the synchronous clients.
     */
    @Bean
    public ClientOverrideConfiguration clientOverrideConfiguration() {
        RetryPolicy adaptiveRetryPolicy = RetryPolicy.forRetryMode(RetryMode.ADAPTIVE).toBuilder()
                                                     .numRetries(s3RetryCount).build();

        return ClientOverrideConfiguration.builder().retryPolicy(adaptiveRetryPolicy).apiCallTimeout(apiCallTimeout)
                                          .build();
    }

    @Bean
    public S3Client s3Client(AwsCredentialsProvider credentialsProvider,
                             ClientOverrideConfiguration clientOverrideConfig) {
        log.info("Configuring AWS S3Client for region: {}", awsRegion);
        return S3Client.builder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                       .overrideConfiguration(clientOverrideConfig).build();
    }

    /**
     * CRT-based async client behind the transfer manager. The CRT client has its own retry configuration.
     */
    @Bean
    public S3AsyncClient s3AsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS S3AsyncClient (CRT) for region: {}", awsRegion);
        S3CrtRetryConfiguration crtRetryConfiguration = S3CrtRetryConfiguration.builder().numRetries(s3RetryCount)
                                                                               .build();

        return S3AsyncClient.crtBuilder().credentialsProvider(credentialsProvider).region(Region.of(awsRegion))
                            .retryConfiguration(crtRetryConfiguration).build();
    }

    @Bean
    public S3TransferManager s3TransferManager(S3AsyncClient s3AsyncClient) {
        return S3TransferManager.builder().s3Client(s3AsyncClient).build();
    }

    @Bean
    public S3Presigner s3Presigner(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS S3Presigner for region: {}", awsRegion);
        return S3Presigner.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider).build();
    }

    @Bean
    public SqsAsyncClient sqsAsyncClient(AwsCredentialsProvider credentialsProvider) {
        log.info("Configuring AWS SqsAsyncClient for region: {}", awsRegion);
        return SqsAsyncClient.builder().region(Region.of(awsRegion)).credentialsProvider(credentialsProvider)
                             .overrideConfiguration(o -> o.apiCallTimeout(apiCallTimeout)).build();
    }
}
