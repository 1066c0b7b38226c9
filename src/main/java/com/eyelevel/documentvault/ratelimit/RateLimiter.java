package com.eyelevel.documentvault.ratelimit;

/**
 * Decides whether a principal may perform one more request right now.
 */
public interface RateLimiter {

    /**
     * Consumes one unit of the principal's budget if available.
     *
     * @return {@code true} if the request may proceed.
     */
    boolean allow(String principalId);
}
