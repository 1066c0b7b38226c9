package com.eyelevel.documentvault.job;

import lombok.extern.slf4j.Slf4j;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves the {@link JobHandler} registered for a job type.
 */
@Slf4j
public class JobHandlerRegistry {

    private final Map<JobType, JobHandler> handlers = new EnumMap<>(JobType.class);

    public JobHandlerRegistry(List<JobHandler> handlers) {
        for (JobHandler handler : handlers) {
            JobHandler previous = this.handlers.put(handler.getJobType(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate handlers for job type " + handler.getJobType() + ": "
                                                + previous.getClass().getSimpleName() + " and "
                                                + handler.getClass().getSimpleName());
            }
        }
        log.info("JobHandlerRegistry initialized with {} handler(s): {}", this.handlers.size(), this.handlers.keySet());
    }

    public Optional<JobHandler> getHandler(JobType type) {
        return Optional.ofNullable(handlers.get(type));
    }
}
