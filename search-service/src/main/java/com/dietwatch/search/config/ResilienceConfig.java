package com.dietwatch.search.config;

import com.dietwatch.search.resilience.RateLimiter;
import com.dietwatch.search.resilience.RetryPolicy;
import io.github.bucket4j.TimeMeter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * The structured-store rate limiter is shared by every caller in the process, so it is built here
 * exactly once.
 */
@Configuration
public class ResilienceConfig {

    @Bean
    @Primary
    public RetryPolicy retryPolicy(
            @Value("${retry.max-retries:3}") int maxRetries,
            @Value("${retry.base-delay-ms:200}") long baseDelayMs,
            @Value("${retry.factor:2.0}") double factor,
            @Value("${retry.jitter:0.2}") double jitter
    ) {
        return new RetryPolicy(maxRetries, Duration.ofMillis(baseDelayMs), factor, jitter);
    }

    @Bean
    public RetryPolicy syncBackoffPolicy(
            @Value("${sync.backoff.base-delay-ms:2000}") long baseDelayMs,
            @Value("${sync.backoff.factor:2.0}") double factor,
            @Value("${sync.backoff.jitter:0.2}") double jitter,
            @Value("${sync.max-attempts:5}") int maxAttempts
    ) {
        return new RetryPolicy(Math.max(0, maxAttempts - 1), Duration.ofMillis(baseDelayMs), factor, jitter);
    }

    @Bean
    public RateLimiter structuredStoreRateLimiter(
            @Value("${rate-limit.capacity:5}") int capacity,
            @Value("${rate-limit.refill-period-ms:1000}") long refillPeriodMs,
            @Value("${rate-limit.max-wait-ms:2000}") long maxWaitMs,
            @Value("${rate-limit.max-queue:50}") int maxQueue,
            @Value("${rate-limit.cooldown-seconds:30}") long cooldownSeconds,
            ObjectProvider<MeterRegistry> meterRegistry
    ) {
        return new RateLimiter(
                capacity,
                Duration.ofMillis(refillPeriodMs),
                Duration.ofMillis(maxWaitMs),
                maxQueue,
                Duration.ofSeconds(cooldownSeconds),
                TimeMeter.SYSTEM_NANOTIME,
                TimeUnit.NANOSECONDS::sleep,
                meterRegistry.getIfAvailable()
        );
    }
}
