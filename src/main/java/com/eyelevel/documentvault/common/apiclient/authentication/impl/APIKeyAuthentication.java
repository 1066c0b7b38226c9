package com.eyelevel.documentvault.common.apiclient.authentication.impl;

import com.eyelevel.documentvault.common.apiclient.authentication.Authentication;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.util.Map;

/**
 * Sends a static API key in a configurable header.
 */
@Slf4j
public record APIKeyAuthentication(String headerName, String apiKey) implements Authentication {

    @Override
    public void applyAuthentication(Map<String, String> headers) {
        if (!StringUtils.hasText(apiKey)) {
            log.debug("No API key configured; sending request without '{}'.", headerName);
            return;
        }
        headers.put(headerName, apiKey);
    }

    @Override
    public String toString() {
        return "APIKeyAuthentication[headerName=" + headerName + "]";
    }
}
