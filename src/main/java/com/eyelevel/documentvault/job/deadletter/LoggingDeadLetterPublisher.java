package com.eyelevel.documentvault.job.deadletter;

import com.eyelevel.documentvault.job.Job;
import lombok.extern.slf4j.Slf4j;

/**
 * Records dead jobs in the application log only.
 */
@Slf4j
public class LoggingDeadLetterPublisher implements DeadLetterPublisher {

    @Override
    public void publish(Job job) {
        log.error("CRITICAL: Job {} ({}) for document {} is dead after {} attempt(s). Last error: {}", job.getId(),
                  job.getType(), job.getPayload().documentId(), job.getAttempts(), job.getLastError());
    }
}
