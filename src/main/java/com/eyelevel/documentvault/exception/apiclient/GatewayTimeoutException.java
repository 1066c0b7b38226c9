package com.eyelevel.documentvault.exception.apiclient;

import java.io.Serial;

public class GatewayTimeoutException extends ApiException {

    @Serial
    private static final long serialVersionUID = 2359187704566021935L;

    public GatewayTimeoutException(String message) {
        super(message, 504);
    }
}
