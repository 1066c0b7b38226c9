package com.eyelevel.documentvault.job;

/**
 * Executes one {@link JobType}.
 *
 * <p>Handlers may run more than once for the same job, so they must be idempotent: repeating a run
 * overwrites earlier results rather than duplicating them.
 */
public interface JobHandler {

    JobType getJobType();

    /**
     * Runs the job. Any exception counts as a failed attempt.
     *
     * @param job       the job being executed.
     * @param submitter the submitter running this job, for enqueueing follow-up work.
     */
    void handle(Job job, JobSubmitter submitter) throws Exception;
}
