package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when a storage backend operation fails.
 */
public class StorageException extends VaultException {
    @Serial
    private static final long serialVersionUID = 2287419305561284731L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
