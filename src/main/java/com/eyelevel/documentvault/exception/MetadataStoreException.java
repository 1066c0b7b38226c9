package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when the metadata store cannot persist or load a document record.
 */
public class MetadataStoreException extends VaultException {
    @Serial
    private static final long serialVersionUID = 1184720359916627045L;

    public MetadataStoreException(String message) {
        super(message);
    }

    public MetadataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
