package com.eyelevel.documentvault.exception.apiclient;

import java.io.Serial;

public class BadRequestException extends ApiException {

    @Serial
    private static final long serialVersionUID = -4414516763190851688L;

    public BadRequestException(String message) {
        super(message, 400);
    }
}
