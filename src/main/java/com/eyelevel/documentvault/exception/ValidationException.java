package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when an upload fails validation before any work is done.
 */
public class ValidationException extends VaultException {
    @Serial
    private static final long serialVersionUID = 2749901831162054739L;

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
