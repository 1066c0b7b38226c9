package com.eyelevel.documentvault.job;

import com.eyelevel.documentvault.job.deadletter.DeadLetterPublisher;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs jobs inline on the submitting thread, for deployments where no queue backend is available.
 *
 * <p>Each job is attempted up to {@code maxAttempts} times back to back, without backoff or timeout.
 * Failures are logged and dead-lettered; {@link #addJob} never throws because of a handler failure.
 * Follow-up jobs submitted by a handler run inline as well.
 */
@Slf4j
public class SynchronousJobSubmitter implements JobSubmitter {

    private final JobHandlerRegistry handlerRegistry;
    private final int maxAttempts;
    private final DeadLetterPublisher deadLetterPublisher;
    private final AtomicLong sequence = new AtomicLong();

    public SynchronousJobSubmitter(JobHandlerRegistry handlerRegistry, int maxAttempts,
                                   DeadLetterPublisher deadLetterPublisher) {
        this.handlerRegistry = handlerRegistry;
        this.maxAttempts = maxAttempts;
        this.deadLetterPublisher = deadLetterPublisher;
        log.warn("Synchronous job submitter active. Background jobs will run inline on the request thread.");
    }

    @Override
    public String addJob(JobType type, JobPayload payload, int priority) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(payload, "payload must not be null");
        Job job = new Job(UUID.randomUUID().toString(), type, payload, priority, sequence.incrementAndGet(),
                          maxAttempts, Instant.now());

        Optional<JobHandler> handler = handlerRegistry.getHandler(type);
        if (handler.isEmpty()) {
            job.markActive();
            job.markDead("No handler registered for job type " + type);
            log.error("Job {} ({}) dropped: no handler registered.", job.getId(), type);
            deadLetterPublisher.publish(job.snapshot());
            return job.getId();
        }

        while (job.getAttempts() < job.getMaxAttempts()) {
            job.markActive();
            try {
                handler.get().handle(job, this);
                job.markCompleted();
                log.info("Job {} ({}) completed inline on attempt {}.", job.getId(), type, job.getAttempts());
                return job.getId();
            } catch (Exception e) {
                String error = e.getClass().getSimpleName() + ": " + e.getMessage();
                if (job.getAttempts() < job.getMaxAttempts()) {
                    job.markRetrying(error);
                    log.warn("Job {} ({}) failed inline attempt {}/{}; retrying. Cause: {}", job.getId(), type,
                             job.getAttempts(), job.getMaxAttempts(), error);
                } else {
                    job.markDead(error);
                    log.error("Job {} ({}) failed all {} inline attempt(s).", job.getId(), type, job.getAttempts(), e);
                }
            }
        }
        deadLetterPublisher.publish(job.snapshot());
        return job.getId();
    }

    /**
     * Inline jobs are finished before {@link #addJob} returns and are not tracked.
     */
    @Override
    public Optional<Job> getJob(String jobId) {
        return Optional.empty();
    }
}
