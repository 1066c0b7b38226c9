package com.eyelevel.documentvault.exception.apiclient;

import java.io.Serial;

public class ServiceUnavailableException extends ApiException {

    @Serial
    private static final long serialVersionUID = -6701184457102983361L;

    public ServiceUnavailableException(String message) {
        super(message, 503);
    }
}
