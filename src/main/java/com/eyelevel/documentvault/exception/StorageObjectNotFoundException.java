package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when an object key does not exist in the storage backend.
 */
public class StorageObjectNotFoundException extends StorageException {
    @Serial
    private static final long serialVersionUID = 8842210937765153016L;

    public StorageObjectNotFoundException(String message) {
        super(message);
    }

    public StorageObjectNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
