package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.exception.ConfigurationException;
import com.eyelevel.documentvault.health.HealthThresholds;
import com.eyelevel.documentvault.health.WorkerHealthMonitor;
import com.eyelevel.documentvault.job.JobHandler;
import com.eyelevel.documentvault.job.JobHandlerRegistry;
import com.eyelevel.documentvault.job.JobQueue;
import com.eyelevel.documentvault.job.JobQueueSettings;
import com.eyelevel.documentvault.job.JobStore;
import com.eyelevel.documentvault.job.JobSubmitter;
import com.eyelevel.documentvault.job.QueueBackendCheck;
import com.eyelevel.documentvault.job.SynchronousJobSubmitter;
import com.eyelevel.documentvault.job.deadletter.DeadLetterPublisher;
import com.eyelevel.documentvault.job.deadletter.LoggingDeadLetterPublisher;
import com.eyelevel.documentvault.job.deadletter.SqsDeadLetterPublisher;
import io.awspring.cloud.sqs.operations.SqsTemplate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import software.amazon.awssdk.services.sqs.SqsAsyncClient;

import java.time.Clock;
import java.util.List;

/**
 * Wires the background job strategy selected by {@code app.jobs.mode}.
 *
 * <ul>
 *     <li>{@code queue}: the in-process worker pool.</li>
 *     <li>{@code synchronous}: jobs run inline on the submitting thread.</li>
 *     <li>{@code auto}: the worker pool if the dead-letter queue answers a single bounded check at startup,
 *     the synchronous strategy otherwise.</li>
 * </ul>
 */
@Slf4j
@Configuration
public class JobQueueConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobHandlerRegistry jobHandlerRegistry(List<JobHandler> handlers) {
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    public DeadLetterPublisher deadLetterPublisher(VaultProperties properties,
                                                   ObjectProvider<SqsTemplate> sqsTemplate) {
        VaultProperties.Jobs.DeadLetter deadLetter = properties.getJobs().getDeadLetter();
        if (!deadLetter.isEnabled()) {
            log.info("Dead-letter queue disabled; dead jobs are only logged.");
            return new LoggingDeadLetterPublisher();
        }
        if (!StringUtils.hasText(deadLetter.getQueueName())) {
            throw new ConfigurationException("app.jobs.dead-letter.queue-name is required when the dead-letter "
                                             + "queue is enabled");
        }
        return new SqsDeadLetterPublisher(sqsTemplate.getObject(), deadLetter.getQueueName());
    }

    @Bean(initMethod = "initialize", destroyMethod = "cleanup")
    public JobSubmitter jobSubmitter(VaultProperties properties, JobHandlerRegistry registry,
                                     DeadLetterPublisher deadLetterPublisher, JobStore jobStore,
                                     ObjectProvider<SqsAsyncClient> sqsAsyncClient) {
        VaultProperties.Jobs jobs = properties.getJobs();
        return switch (jobs.getMode()) {
            case QUEUE -> jobQueue(jobs, registry, deadLetterPublisher, jobStore);
            case SYNCHRONOUS -> synchronous(jobs, registry, deadLetterPublisher);
            case AUTO -> {
                if (queueBackendReachable(jobs, sqsAsyncClient)) {
                    yield jobQueue(jobs, registry, deadLetterPublisher, jobStore);
                }
                log.warn("Queue backend unavailable. Falling back to synchronous job execution.");
                yield synchronous(jobs, registry, deadLetterPublisher);
            }
        };
    }

    @Bean
    public WorkerHealthMonitor workerHealthMonitor(JobSubmitter jobSubmitter, VaultProperties properties,
                                                   Clock clock) {
        VaultProperties.Health health = properties.getHealth();
        HealthThresholds thresholds = new HealthThresholds(health.getMaxQueueDepthAlert(),
                                                           health.getFailedDegradedThreshold(),
                                                           health.getFailedUnhealthyThreshold(),
                                                           health.getBacklogThreshold());
        return new WorkerHealthMonitor(jobSubmitter instanceof JobQueue jobQueue ? jobQueue : null, thresholds,
                                       clock);
    }

    private boolean queueBackendReachable(VaultProperties.Jobs jobs, ObjectProvider<SqsAsyncClient> sqsAsyncClient) {
        String queueName = jobs.getDeadLetter().getQueueName();
        if (!jobs.getDeadLetter().isEnabled() || !StringUtils.hasText(queueName)) {
            log.info("No dead-letter queue configured; the in-process worker pool needs no external backend.");
            return true;
        }
        return new QueueBackendCheck(sqsAsyncClient.getObject(), queueName, jobs.getBackendCheckTimeout()).isAvailable();
    }

    private static JobQueue jobQueue(VaultProperties.Jobs jobs, JobHandlerRegistry registry,
                                     DeadLetterPublisher deadLetterPublisher, JobStore jobStore) {
        JobQueueSettings settings = new JobQueueSettings(jobs.getConcurrency(), jobs.getTimeout(),
                                                         jobs.getMaxAttempts(), jobs.getBackoffBase(),
                                                         jobs.getBackoffMax(), jobs.getMaxQueueSize(),
                                                         jobs.getShutdownGrace(), jobs.getCompletedRetention(),
                                                         jobs.getFailedRetention());
        log.info("Using queued job execution with concurrency {}.", settings.concurrency());
        return new JobQueue(registry, settings, deadLetterPublisher, jobStore);
    }

    private static SynchronousJobSubmitter synchronous(VaultProperties.Jobs jobs, JobHandlerRegistry registry,
                                                       DeadLetterPublisher deadLetterPublisher) {
        log.info("Using synchronous job execution.");
        return new SynchronousJobSubmitter(registry, jobs.getMaxAttempts(), deadLetterPublisher);
    }
}
