package com.eyelevel.documentvault.job;

import java.time.Duration;

/**
 * Tuning for a {@link JobQueue}.
 *
 * @param maxAttempts total executions per job, including the first.
 */
public record JobQueueSettings(int concurrency, Duration timeout, int maxAttempts, Duration backoffBase,
                               Duration backoffMax, int maxQueueSize, Duration shutdownGrace,
                               int completedRetention, int failedRetention) {

    public JobQueueSettings {
        if (concurrency <= 0 || maxAttempts <= 0 || maxQueueSize <= 0) {
            throw new IllegalArgumentException("Concurrency, max attempts and max queue size must be positive");
        }
    }

    /**
     * Exponential backoff: the delay before the retry that follows the given number of failed
     * attempts is {@code base * 2^(failedAttempts - 1)}, capped at {@code backoffMax}.
     */
    public Duration backoffFor(int failedAttempts) {
        int exponent = Math.max(0, Math.min(failedAttempts - 1, 30));
        long delayMillis = backoffBase.toMillis() * (1L << exponent);
        return Duration.ofMillis(Math.min(delayMillis, backoffMax.toMillis()));
    }
}
