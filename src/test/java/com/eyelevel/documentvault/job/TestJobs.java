package com.eyelevel.documentvault.job;

import java.time.Instant;
import java.util.UUID;

/**
 * Builds active jobs for handler tests outside this package.
 */
public final class TestJobs {

    private TestJobs() {
    }

    public static Job activeJob(JobType type, JobPayload payload) {
        Job job = new Job(UUID.randomUUID().toString(), type, payload, Job.DEFAULT_PRIORITY, 1, 3, Instant.now());
        job.markActive();
        return job;
    }
}
