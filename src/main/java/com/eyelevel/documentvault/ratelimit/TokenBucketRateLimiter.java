package com.eyelevel.documentvault.ratelimit;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-principal token buckets with lazy, fractional refill.
 *
 * <p>A new principal starts with a full bucket. Tokens are topped up from elapsed time on each call,
 * never beyond capacity, and each allowed request consumes one whole token. Every read-modify-write
 * of a bucket runs inside {@link ConcurrentHashMap#compute}, so concurrent calls for the same principal
 * cannot double-spend a token.
 */
@Slf4j
public class TokenBucketRateLimiter implements RateLimiter {

    private final int capacity;
    private final double refillPerSecond;
    private final Duration idleTtl;
    private final Clock clock;
    private final ConcurrentMap<String, Bucket> buckets = new ConcurrentHashMap<>();

    public TokenBucketRateLimiter(int capacity, double refillPerSecond, Duration idleTtl, Clock clock) {
        if (capacity <= 0 || refillPerSecond <= 0) {
            throw new IllegalArgumentException("Capacity and refill rate must be positive");
        }
        this.capacity = capacity;
        this.refillPerSecond = refillPerSecond;
        this.idleTtl = idleTtl;
        this.clock = clock;
        log.info("Token bucket rate limiter initialized. Capacity: {}, refill: {}/s, idle TTL: {}", capacity,
                 refillPerSecond, idleTtl);
    }

    @Override
    public boolean allow(String principalId) {
        AtomicBoolean allowed = new AtomicBoolean(false);
        long now = clock.millis();
        buckets.compute(principalId, (id, existing) -> {
            Bucket bucket = existing != null ? existing : new Bucket(capacity, now);
            bucket.refill(now, capacity, refillPerSecond);
            allowed.set(bucket.tryConsume());
            return bucket;
        });
        if (!allowed.get()) {
            log.debug("Rate limit reached for principal '{}'.", principalId);
        }
        return allowed.get();
    }

    /**
     * Drops buckets that have not been touched for longer than the idle TTL.
     *
     * @return the number of buckets removed.
     */
    public int evictIdle() {
        long cutoff = clock.millis() - idleTtl.toMillis();
        int removed = 0;
        for (String principalId : buckets.keySet()) {
            AtomicBoolean evicted = new AtomicBoolean(false);
            buckets.computeIfPresent(principalId, (id, bucket) -> {
                if (bucket.lastRefillMillis < cutoff) {
                    evicted.set(true);
                    return null;
                }
                return bucket;
            });
            if (evicted.get()) {
                removed++;
            }
        }
        return removed;
    }

    public int getTrackedPrincipalCount() {
        return buckets.size();
    }

    public RateLimiterStats getStats() {
        return new RateLimiterStats(buckets.size(), capacity, refillPerSecond, idleTtl);
    }

    /**
     * @return tokens currently available to a principal, without consuming any. Unknown principals
     *         report a full bucket.
     */
    public double getAvailableTokens(String principalId) {
        Bucket bucket = buckets.get(principalId);
        if (bucket == null) {
            return capacity;
        }
        synchronized (bucket) {
            double elapsedSeconds = Math.max(0, clock.millis() - bucket.lastRefillMillis) / 1000.0;
            return Math.min(capacity, bucket.tokens + elapsedSeconds * refillPerSecond);
        }
    }

    private static final class Bucket {

        private double tokens;
        private long lastRefillMillis;

        private Bucket(int capacity, long now) {
            this.tokens = capacity;
            this.lastRefillMillis = now;
        }

        private synchronized void refill(long now, int capacity, double refillPerSecond) {
            long elapsed = now - lastRefillMillis;
            if (elapsed > 0) {
                tokens = Math.min(capacity, tokens + elapsed / 1000.0 * refillPerSecond);
                lastRefillMillis = now;
            }
        }

        private synchronized boolean tryConsume() {
            if (tokens >= 1.0) {
                tokens -= 1.0;
                return true;
            }
            return false;
        }
    }
}
