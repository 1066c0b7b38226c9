package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Reported when a job has used up all of its attempts and is dead-lettered.
 */
public class JobExhaustedException extends VaultException {
    @Serial
    private static final long serialVersionUID = -2307715541969203378L;

    public JobExhaustedException(String message) {
        super(message);
    }

    public JobExhaustedException(String message, Throwable cause) {
        super(message, cause);
    }
}
