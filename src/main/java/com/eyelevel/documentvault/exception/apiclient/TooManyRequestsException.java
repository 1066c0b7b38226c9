package com.eyelevel.documentvault.exception.apiclient;

import java.io.Serial;

public class TooManyRequestsException extends ApiException {

    @Serial
    private static final long serialVersionUID = 7813320048816237754L;

    public TooManyRequestsException(String message) {
        super(message, 429);
    }
}
