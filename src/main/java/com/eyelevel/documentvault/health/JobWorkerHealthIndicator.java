package com.eyelevel.documentvault.health;

import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.actuate.health.Status;

/**
 * Exposes the worker health through the actuator health endpoint as {@code jobWorker}.
 */
@RequiredArgsConstructor
public class JobWorkerHealthIndicator implements HealthIndicator {

    static final Status DEGRADED = new Status("DEGRADED", "Job worker is running with reduced capacity");

    private final WorkerHealthMonitor monitor;

    @Override
    public Health health() {
        HealthReport report = monitor.getHealthStatus();
        Health.Builder builder = switch (report.getStatus()) {
            case HEALTHY -> Health.up();
            case DEGRADED -> Health.status(DEGRADED);
            case UNHEALTHY -> Health.down();
        };
        builder.withDetail("initialized", report.isInitialized())
               .withDetail("alerts", report.getAlerts())
               .withDetail("recentErrors", report.getRecentErrors())
               .withDetail("maxConcurrency", report.getMaxConcurrency())
               .withDetail("jobTimeoutMs", report.getJobTimeoutMillis())
               .withDetail("maxQueueDepthAlert", report.getMaxQueueDepthAlert());
        if (report.getMetrics() != null) {
            builder.withDetail("metrics", report.getMetrics());
        }
        return builder.build();
    }
}
