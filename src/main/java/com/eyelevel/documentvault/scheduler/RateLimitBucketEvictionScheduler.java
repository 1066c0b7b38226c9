package com.eyelevel.documentvault.scheduler;

import com.eyelevel.documentvault.ratelimit.TokenBucketRateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drops rate limit buckets of principals that have been idle longer than the configured TTL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RateLimitBucketEvictionScheduler {

    private final TokenBucketRateLimiter rateLimiter;

    @Scheduled(cron = "${app.scheduler.rate-limit-eviction}")
    public void evictIdleBuckets() {
        int evicted = rateLimiter.evictIdle();
        if (evicted > 0) {
            log.info("Evicted {} idle rate limit bucket(s). {} still tracked.", evicted,
                     rateLimiter.getTrackedPrincipalCount());
        } else {
            log.debug("No idle rate limit buckets to evict.");
        }
    }
}
