package com.eyelevel.documentvault.job;

/**
 * Lifecycle of a job. {@code COMPLETED} and {@code DEAD} are terminal.
 */
public enum JobStatus {
    WAITING,
    ACTIVE,
    COMPLETED,
    FAILED_RETRY,
    DEAD;

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD;
    }
}
