package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.storage.StorageType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.Set;

/**
 * Binds application properties under the "app" prefix to a strongly-typed configuration object.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class VaultProperties {

    @Valid
    private Encryption encryption = new Encryption();
    @Valid
    private Storage storage = new Storage();
    @Valid
    private Jobs jobs = new Jobs();
    private Health health = new Health();
    @Valid
    private RateLimit rateLimit = new RateLimit();
    private Conversion conversion = new Conversion();
    private Insights insights = new Insights();

    @Data
    public static class Encryption {
        /**
         * 64 hex characters. Usually supplied through DOCUMENT_MASTER_KEY.
         */
        private String masterKey;
        private boolean enabled = true;
        private boolean selfTestOnStartup = true;
        @Min(1024)
        private int chunkSize = 64 * 1024;
    }

    @Data
    public static class Storage {
        @NotNull
        private StorageType type = StorageType.LOCAL;
        @Positive
        private long signedUrlTtlSeconds = 3600;
        private Local local = new Local();
        private S3 s3 = new S3();

        @Data
        public static class Local {
            private String basePath = "./storage";
        }

        @Data
        public static class S3 {
            private String bucketName;
        }
    }

    @Data
    public static class Jobs {
        @NotNull
        private Mode mode = Mode.AUTO;
        @Min(1)
        private int concurrency = 4;
        @NotNull
        private Duration timeout = Duration.ofMinutes(5);
        @Min(1)
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(2);
        private Duration backoffMax = Duration.ofMinutes(5);
        @Min(1)
        private int maxQueueSize = 10_000;
        private Duration shutdownGrace = Duration.ofSeconds(30);
        private int completedRetention = 50;
        private int failedRetention = 20;
        private Duration backendCheckTimeout = Duration.ofSeconds(5);
        private DeadLetter deadLetter = new DeadLetter();

        public enum Mode {
            QUEUE,
            SYNCHRONOUS,
            AUTO
        }

        @Data
        public static class DeadLetter {
            private boolean enabled;
            private String queueName;
        }
    }

    @Data
    public static class Health {
        private int maxQueueDepthAlert = 1000;
        private long failedDegradedThreshold = 10;
        private long failedUnhealthyThreshold = 50;
        private int backlogThreshold = 100;
    }

    @Data
    public static class RateLimit {
        @Min(1)
        private int capacity = 30;
        @Positive
        private double refillPerSecond = 1.0;
        private Duration idleTtl = Duration.ofMinutes(10);
    }

    @Data
    public static class RetryConfig {
        private int attempts;
        private long delayMs;
    }

    @Data
    public static class Conversion {
        private boolean enabled;
        private RetryConfig retry = new RetryConfig();
        private Set<String> convertibleExtensions = Set.of("doc", "docx", "ppt", "pptx", "xls", "xlsx", "rtf", "odt",
                                                           "ods", "odp");
        private Office office = new Office();

        @Data
        public static class Office {
            private String home;
            private int[] portNumbers = {2002};
            private long taskExecutionTimeout = 120_000;
        }
    }

    @Data
    public static class Insights {
        private boolean enabled;
        private String baseUrl;
        private String endpoint = "/v1/insights";
        private String authKeyName = "X-API-Key";
        private String authKeyValue;
    }
}
