package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when a storage backend does not support the requested operation, such as signed URLs on local disk.
 */
public class StorageProviderException extends StorageException {
    @Serial
    private static final long serialVersionUID = 5810372296113472655L;

    public StorageProviderException(String message) {
        super(message);
    }

    public StorageProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
