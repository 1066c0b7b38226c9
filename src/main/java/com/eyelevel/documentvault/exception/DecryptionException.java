package com.eyelevel.documentvault.exception;

import java.io.Serial;

/**
 * Thrown when ciphertext or a wrapped key fails authentication, is truncated, or cannot be decrypted with the supplied key.
 */
public class DecryptionException extends EncryptionException {
    @Serial
    private static final long serialVersionUID = 6120448733901287513L;

    public DecryptionException(String message) {
        super(message);
    }

    public DecryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
