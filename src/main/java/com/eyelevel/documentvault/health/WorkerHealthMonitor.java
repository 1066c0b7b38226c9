package com.eyelevel.documentvault.health;

import com.eyelevel.documentvault.job.Job;
import com.eyelevel.documentvault.job.JobQueue;
import com.eyelevel.documentvault.job.JobQueueListener;
import com.eyelevel.documentvault.job.QueueMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Classifies the job worker as healthy, degraded or unhealthy from queue metrics and keeps the
 * last few job errors for operators.
 *
 * <p>Rules are evaluated in order and the worst result wins:
 * <ol>
 *     <li>no worker queue, or a queue not accepting jobs: unhealthy, "not initialized"</li>
 *     <li>dead jobs above the unhealthy threshold: unhealthy</li>
 *     <li>dead jobs above the degraded threshold: degraded</li>
 *     <li>waiting jobs above the queue depth alert: degraded</li>
 *     <li>all workers busy and waiting jobs above the backlog threshold: degraded</li>
 * </ol>
 */
@Slf4j
public class WorkerHealthMonitor implements JobQueueListener {

    static final int MAX_RECENT_ERRORS = 10;

    @Nullable
    private final JobQueue jobQueue;
    private final HealthThresholds thresholds;
    private final Clock clock;
    private final Deque<String> recentErrors = new ArrayDeque<>(MAX_RECENT_ERRORS);

    private volatile HealthReport lastReport;

    public WorkerHealthMonitor(@Nullable JobQueue jobQueue, HealthThresholds thresholds, Clock clock) {
        this.jobQueue = jobQueue;
        this.thresholds = thresholds;
        this.clock = clock;
        if (jobQueue != null) {
            jobQueue.addListener(this);
        }
    }

    public HealthReport getHealthStatus() {
        List<String> alerts = new ArrayList<>();
        QueueMetrics metrics = null;
        HealthStatus status;

        if (jobQueue == null) {
            alerts.add("Worker not initialized");
            status = HealthStatus.UNHEALTHY;
        } else {
            try {
                metrics = jobQueue.metrics();
                status = evaluate(metrics, alerts);
            } catch (RuntimeException e) {
                log.error("Health check failed while reading queue metrics.", e);
                recordError("Health check failed: " + e.getMessage());
                alerts.add("Health check failed: " + e.getMessage());
                status = HealthStatus.UNHEALTHY;
            }
        }

        HealthReport report = HealthReport.builder()
                                          .status(status)
                                          .timestamp(clock.instant())
                                          .initialized(metrics != null && metrics.accepting())
                                          .metrics(metrics)
                                          .alerts(List.copyOf(alerts))
                                          .recentErrors(getRecentErrors())
                                          .maxConcurrency(jobQueue != null ? jobQueue.getSettings().concurrency() : 0)
                                          .jobTimeoutMillis(jobQueue != null
                                                  ? jobQueue.getSettings().timeout().toMillis() : 0)
                                          .maxQueueDepthAlert(thresholds.maxQueueDepthAlert())
                                          .build();
        if (status != HealthStatus.HEALTHY) {
            log.warn("Worker health is {}: {}", status, alerts);
        }
        lastReport = report;
        return report;
    }

    @Nullable
    public HealthReport getLastReport() {
        return lastReport;
    }

    public List<String> getRecentErrors() {
        synchronized (recentErrors) {
            return List.copyOf(recentErrors);
        }
    }

    @Override
    public void onJobFailed(Job job, Throwable error, boolean willRetry) {
        recordError(String.format("Job %s (%s) attempt %d/%d failed%s: %s", job.getId(), job.getType(),
                                  job.getAttempts(), job.getMaxAttempts(), willRetry ? ", retrying" : "",
                                  error != null ? error.getMessage() : job.getLastError()));
    }

    @Override
    public void onJobDead(Job job, Throwable error) {
        recordError(String.format("Job %s (%s) dead-lettered after %d attempt(s)", job.getId(), job.getType(),
                                  job.getAttempts()));
    }

    void recordError(String message) {
        synchronized (recentErrors) {
            if (recentErrors.size() == MAX_RECENT_ERRORS) {
                recentErrors.removeFirst();
            }
            recentErrors.addLast(clock.instant() + ": " + message);
        }
    }

    private HealthStatus evaluate(QueueMetrics metrics, List<String> alerts) {
        HealthStatus status = HealthStatus.HEALTHY;
        if (!metrics.accepting()) {
            alerts.add("Worker not initialized");
            status = HealthStatus.UNHEALTHY;
        }
        if (metrics.failed() > thresholds.failedUnhealthyThreshold()) {
            alerts.add("Dead jobs (" + metrics.failed() + ") above " + thresholds.failedUnhealthyThreshold());
            status = HealthStatus.UNHEALTHY;
        } else if (metrics.failed() > thresholds.failedDegradedThreshold()) {
            alerts.add("Dead jobs (" + metrics.failed() + ") above " + thresholds.failedDegradedThreshold());
            status = worst(status, HealthStatus.DEGRADED);
        }
        if (metrics.waiting() > thresholds.maxQueueDepthAlert()) {
            alerts.add("Queue depth (" + metrics.waiting() + ") above " + thresholds.maxQueueDepthAlert());
            status = worst(status, HealthStatus.DEGRADED);
        }
        if (metrics.active() >= metrics.concurrency() && metrics.waiting() > thresholds.backlogThreshold()) {
            alerts.add("All " + metrics.concurrency() + " workers busy with " + metrics.waiting() + " jobs waiting");
            status = worst(status, HealthStatus.DEGRADED);
        }
        return status;
    }

    private static HealthStatus worst(HealthStatus current, HealthStatus candidate) {
        return candidate.ordinal() > current.ordinal() ? candidate : current;
    }
}
