package com.eyelevel.documentvault.health;

import com.eyelevel.documentvault.job.QueueMetrics;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.springframework.lang.Nullable;

import java.time.Instant;
import java.util.List;

/**
 * Result of a worker health evaluation.
 */
@Builder
@Getter
@ToString
public class HealthReport {

    private final HealthStatus status;

    private final Instant timestamp;

    private final boolean initialized;

    /**
     * Queue counters at evaluation time; {@code null} when the worker is not initialized.
     */
    @Nullable
    private final QueueMetrics metrics;

    /**
     * Thresholds that were breached, in evaluation order.
     */
    private final List<String> alerts;

    /**
     * Most recent job errors, oldest first, each prefixed with an ISO-8601 timestamp.
     */
    private final List<String> recentErrors;

    private final int maxConcurrency;

    private final long jobTimeoutMillis;

    private final int maxQueueDepthAlert;
}
