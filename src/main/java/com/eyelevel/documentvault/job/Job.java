package com.eyelevel.documentvault.job;

import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A unit of work tracked by a {@link JobSubmitter}.
 *
 * <p>State transitions are only made by the owning queue while it holds its lock; handlers must treat
 * the job as read-only.
 */
@Getter
@ToString
public class Job {

    public static final int DEFAULT_PRIORITY = 5;

    private final String id;
    private final JobType type;
    private final JobPayload payload;
    private final int priority;
    private final long sequence;
    private final int maxAttempts;
    private final Instant createdAt;

    private JobStatus status;
    private int attempts;
    private String lastError;
    private Instant updatedAt;

    Job(String id, JobType type, JobPayload payload, int priority, long sequence, int maxAttempts, Instant createdAt) {
        this.id = id;
        this.type = type;
        this.payload = payload;
        this.priority = priority;
        this.sequence = sequence;
        this.maxAttempts = maxAttempts;
        this.createdAt = createdAt;
        this.status = JobStatus.WAITING;
        this.updatedAt = createdAt;
    }

    private Job(Job source) {
        this(source.id, source.type, source.payload, source.priority, source.sequence, source.maxAttempts,
             source.createdAt);
        this.status = source.status;
        this.attempts = source.attempts;
        this.lastError = source.lastError;
        this.updatedAt = source.updatedAt;
    }

    /**
     * Rebuilds a job from its persisted state.
     */
    public static Job restore(String id, JobType type, JobPayload payload, int priority, long sequence,
                              int maxAttempts, Instant createdAt, JobStatus status, int attempts, String lastError,
                              Instant updatedAt) {
        Job job = new Job(id, type, payload, priority, sequence, maxAttempts, createdAt);
        job.status = status;
        job.attempts = attempts;
        job.lastError = lastError;
        job.updatedAt = updatedAt;
        return job;
    }

    /**
     * @return a detached copy safe to hand to callers outside the queue.
     */
    public Job snapshot() {
        return new Job(this);
    }

    void markActive() {
        attempts++;
        transition(JobStatus.ACTIVE);
    }

    void markWaiting() {
        transition(JobStatus.WAITING);
    }

    /**
     * Puts an unfinished job found at startup back in line. An attempt that was still running when the
     * previous worker stopped did not reach an outcome, so it is not counted.
     */
    void markRecovered() {
        if (status == JobStatus.ACTIVE && attempts > 0) {
            attempts--;
        }
        transition(JobStatus.WAITING);
    }

    void markCompleted() {
        lastError = null;
        transition(JobStatus.COMPLETED);
    }

    void markRetrying(String error) {
        lastError = error;
        transition(JobStatus.FAILED_RETRY);
    }

    void markDead(String error) {
        lastError = error;
        transition(JobStatus.DEAD);
    }

    private void transition(JobStatus next) {
        status = next;
        updatedAt = Instant.now();
    }
}
