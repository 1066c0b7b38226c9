package com.eyelevel.documentvault.exception.apiclient;

import lombok.Getter;

import java.io.Serial;

/**
 * Base class for errors returned by, or raised while calling, an external HTTP API.
 *
 * <p>Carries the HTTP status code so callers can tell transient failures (5xx, 429) apart from
 * requests that will never succeed.
 */
@Getter
public class ApiException extends RuntimeException {

    @Serial
    private static final long serialVersionUID = 4830840555831897529L;
    private final int statusCode;

    public ApiException(String message, int statusCode) {
        super(message);
        this.statusCode = statusCode;
    }

    /**
     * @return {@code true} when retrying the same request may succeed.
     */
    public boolean isTransient() {
        return statusCode == 429 || statusCode >= 500;
    }
}
