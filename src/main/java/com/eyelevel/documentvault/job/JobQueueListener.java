package com.eyelevel.documentvault.job;

/**
 * Observes job outcomes. Callbacks run on worker or timer threads and must not block.
 */
public interface JobQueueListener {

    default void onJobCompleted(Job job) {
    }

    /**
     * Called for every failed attempt, including the last one.
     */
    default void onJobFailed(Job job, Throwable error, boolean willRetry) {
    }

    default void onJobDead(Job job, Throwable error) {
    }
}
