package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when encrypting a file or wrapping a document key fails.
 */
public class EncryptionException extends VaultException {
    @Serial
    private static final long serialVersionUID = 3391057712846120964L;

    public EncryptionException(String message) {
        super(message);
    }

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
