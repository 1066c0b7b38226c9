package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when a metadata record points at a storage object that no longer exists.
 */
public class OrphanRecordException extends VaultException {
    @Serial
    private static final long serialVersionUID = 5576120938474101182L;

    public OrphanRecordException(String message) {
        super(message);
    }

    public OrphanRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
