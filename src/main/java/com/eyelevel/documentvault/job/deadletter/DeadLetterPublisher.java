package com.eyelevel.documentvault.job.deadletter;

import com.eyelevel.documentvault.job.Job;

/**
 * Receives jobs that exhausted their attempts so they can be inspected or replayed.
 */
public interface DeadLetterPublisher {

    /**
     * Publishes a dead job. Implementations must not throw; a failed publish is logged.
     */
    void publish(Job job);
}
