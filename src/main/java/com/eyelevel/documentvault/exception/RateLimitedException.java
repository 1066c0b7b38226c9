package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when a principal has exhausted its request budget.
 */
public class RateLimitedException extends VaultException {
    @Serial
    private static final long serialVersionUID = 9013365220147780245L;

    public RateLimitedException(String message) {
        super(message);
    }

    public RateLimitedException(String message, Throwable cause) {
        super(message, cause);
    }
}
