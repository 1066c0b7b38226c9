package com.eyelevel.documentvault.job;

import com.eyelevel.documentvault.exception.JobRejectedException;

import java.util.Optional;

/**
 * Accepts background jobs. Implementations either queue them for worker threads or run them inline.
 */
public interface JobSubmitter {

    /**
     * Submits a job.
     *
     * @param priority higher values run first; ties run in submission order.
     *
     * @return the job id.
     *
     * @throws JobRejectedException if the job cannot be accepted.
     */
    String addJob(JobType type, JobPayload payload, int priority);

    default String addJob(JobType type, JobPayload payload) {
        return addJob(type, payload, Job.DEFAULT_PRIORITY);
    }

    /**
     * @return a snapshot of the job if it is still tracked.
     */
    Optional<Job> getJob(String jobId);

    default void initialize() {
    }

    default void cleanup() {
    }
}
