package com.eyelevel.documentvault.exception.apiclient;

import java.io.Serial;

public class UnauthorizedException extends ApiException {

    @Serial
    private static final long serialVersionUID = -2210657839910044716L;

    public UnauthorizedException(String message) {
        super(message, 401);
    }
}
