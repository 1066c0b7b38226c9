package com.eyelevel.documentvault.common.apiclient.model;

import lombok.Builder;
import lombok.Getter;
import org.springframework.lang.Nullable;

import java.time.Instant;

/**
 * A successful response from an external API.
 */
@Builder
@Getter
public class ApiResponse {

    @Nullable
    private final byte[] data;

    private final int statusCode;

    private final Instant timestamp;
}
