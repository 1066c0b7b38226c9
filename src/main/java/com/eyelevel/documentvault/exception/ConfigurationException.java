package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when required configuration is missing or malformed. Raised at startup, it aborts the application.
 */
public class ConfigurationException extends VaultException {
    @Serial
    private static final long serialVersionUID = 7132904518273645120L;

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
