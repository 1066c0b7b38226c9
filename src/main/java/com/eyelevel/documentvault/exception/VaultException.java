package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * A base exception for errors raised by the document vault pipeline.
 */
public class VaultException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = 4656352395708234308L;

    public VaultException(String message) {
        super(message);
    }

    public VaultException(String message, Throwable cause) {
        super(message, cause);
    }
}
