package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Recorded as the failure cause of a job execution that exceeded its time budget.
 */
public class JobTimeoutException extends VaultException {
    @Serial
    private static final long serialVersionUID = 4412087351205593718L;

    public JobTimeoutException(String message) {
        super(message);
    }

    public JobTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
