package com.eyelevel.documentvault.exception.json;

import com.eyelevel.documentvault.exception.VaultException;

import java.io.Serial;

/**
 * Thrown when a JSON document cannot be serialized or parsed.
 */
public class JsonParsingException extends VaultException {
    @Serial
    private static final long serialVersionUID = 3029476158812734901L;

    public JsonParsingException(String message, Throwable cause) {
        super(message, cause);
    }
}
