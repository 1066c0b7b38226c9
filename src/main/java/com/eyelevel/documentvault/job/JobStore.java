package com.eyelevel.documentvault.job;

import java.util.List;

/**
 * Durable journal of queued jobs. The queue writes every state change through it, and on startup
 * re-queues whatever a previous worker left unfinished.
 */
public interface JobStore {

    /**
     * Inserts or replaces the stored state of {@code job}.
     */
    void save(Job job);

    /**
     * @return jobs in {@link JobStatus#WAITING}, {@link JobStatus#ACTIVE} or {@link JobStatus#FAILED_RETRY},
     *         oldest submission first.
     */
    List<Job> findUnfinished();
}
