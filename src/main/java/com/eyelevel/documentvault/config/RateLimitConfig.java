package com.eyelevel.documentvault.config;

import com.eyelevel.documentvault.ratelimit.TokenBucketRateLimiter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class RateLimitConfig {

    @Bean
    public TokenBucketRateLimiter rateLimiter(VaultProperties properties, Clock clock) {
        VaultProperties.RateLimit rateLimit = properties.getRateLimit();
        return new TokenBucketRateLimiter(rateLimit.getCapacity(), rateLimit.getRefillPerSecond(),
                                          rateLimit.getIdleTtl(), clock);
    }
}
