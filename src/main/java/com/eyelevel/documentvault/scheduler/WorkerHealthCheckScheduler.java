package com.eyelevel.documentvault.scheduler;

import com.eyelevel.documentvault.health.HealthReport;
import com.eyelevel.documentvault.health.HealthStatus;
import com.eyelevel.documentvault.health.WorkerHealthMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically evaluates worker health so problems show up in the logs without anyone polling the
 * health endpoint.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkerHealthCheckScheduler {

    private final WorkerHealthMonitor healthMonitor;

    @Scheduled(cron = "${app.scheduler.worker-health-check}")
    public void checkWorkerHealth() {
        HealthReport report = healthMonitor.getHealthStatus();
        if (report.getStatus() == HealthStatus.HEALTHY) {
            log.debug("Worker health: HEALTHY. Metrics: {}", report.getMetrics());
        } else {
            log.warn("Worker health: {}. Alerts: {}", report.getStatus(), report.getAlerts());
        }
    }
}
