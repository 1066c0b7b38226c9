package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when the job queue refuses a submission, either because it is not accepting work or because it is full.
 */
public class JobRejectedException extends VaultException {
    @Serial
    private static final long serialVersionUID = 1937745620018835562L;

    public JobRejectedException(String message) {
        super(message);
    }

    public JobRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
