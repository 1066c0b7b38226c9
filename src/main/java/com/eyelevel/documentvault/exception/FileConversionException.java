package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when converting an upload to its canonical format fails.
 */
public class FileConversionException extends VaultException {
    @Serial
    private static final long serialVersionUID = 6638201145287700316L;

    public FileConversionException(String message) {
        super(message);
    }

    public FileConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
