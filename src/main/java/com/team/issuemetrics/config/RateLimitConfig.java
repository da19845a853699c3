package com.team.issuemetrics.config;

import io.github.bucket4j.Bucket;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class RateLimitConfig {

    @Value("${rate-limit.claude-api.requests-per-minute:30}")
    private int requestsPerMinute;

    @Value("${rate-limit.claude-api.requests-per-hour:500}")
    private int requestsPerHour;

    /** bucket 用完與 API 回 429 同樣視為 rate limit */
    @Bean(name = "claudeApiRateLimiter")
    public Bucket claudeApiRateLimiter() {
        return Bucket.builder()
                .addLimit(limit -> limit.capacity(requestsPerMinute).refillGreedy(requestsPerMinute, Duration.ofMinutes(1)))
                .addLimit(limit -> limit.capacity(requestsPerHour).refillGreedy(requestsPerHour, Duration.ofHours(1)))
                .build();
    }
}
