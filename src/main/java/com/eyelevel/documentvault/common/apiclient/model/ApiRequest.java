package com.eyelevel.documentvault.common.apiclient.model;

import lombok.Builder;
import lombok.Data;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.lang.Nullable;

import java.util.HashMap;
import java.util.Map;

/**
 * A request to an external API.
 */
@Builder
@Data
public class ApiRequest {

    private final HttpMethod method;

    private final String path;

    @Nullable
    private final Map<String, Object> queryParams;

    /**
     * Mutable so authentication can add its headers.
     */
    private final Map<String, String> headers = new HashMap<>();

    @Nullable
    private final Object body;

    @Nullable
    private final MediaType contentType;
}
