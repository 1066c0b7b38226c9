package com.eyelevel.documentvault.ratelimit;

import java.time.Duration;

/**
 * Point-in-time view of a {@link TokenBucketRateLimiter}.
 */
public record RateLimiterStats(int trackedPrincipals, int capacity, double refillPerSecond, Duration idleTtl) {
}
