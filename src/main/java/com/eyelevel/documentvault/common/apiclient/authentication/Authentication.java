package com.eyelevel.documentvault.common.apiclient.authentication;

import java.util.Map;

/**
 * Applies an authentication scheme to the headers of an outgoing API request.
 */
public interface Authentication {

    void applyAuthentication(Map<String, String> headers);
}
