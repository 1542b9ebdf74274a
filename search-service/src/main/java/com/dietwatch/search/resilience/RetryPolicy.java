package com.dietwatch.search.resilience;

import com.dietwatch.search.exception.BackendTimeoutException;
import com.dietwatch.search.exception.BackendUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Exponential backoff with jitter shared by the structured store, the vector store and the
 * embedding provider. The sync queue reuses {@link #delayForAttempt(int)} for job backoff.
 */
public class RetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    public static final Predicate<Throwable> TRANSIENT = ex ->
            ex instanceof BackendTimeoutException || ex instanceof BackendUnavailableException;

    private final int maxRetries;
    private final Duration baseDelay;
    private final double factor;
    private final double jitter;
    private final IntervalFunction intervalFunction;

    public RetryPolicy(int maxRetries, Duration baseDelay, double factor, double jitter) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        this.maxRetries = maxRetries;
        this.baseDelay = baseDelay;
        this.factor = factor;
        this.jitter = jitter;
        this.intervalFunction = jitter > 0
                ? IntervalFunction.ofExponentialRandomBackoff(baseDelay, factor, jitter)
                : IntervalFunction.ofExponentialBackoff(baseDelay, factor);
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), 2.0, 0.2);
    }

    public Retry toRetry(String name) {
        return toRetry(name, TRANSIENT);
    }

    public Retry toRetry(String name, Predicate<Throwable> retryOn) {
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts())
                .intervalFunction(intervalFunction)
                .retryOnException(retryOn)
                .build();
        Retry retry = Retry.of(name, config);
        retry.getEventPublisher().onRetry(event -> log.warn(
                "event=retry backend={} attempt={} wait_ms={} cause={}",
                name,
                event.getNumberOfRetryAttempts(),
                event.getWaitInterval().toMillis(),
                String.valueOf(event.getLastThrowable())
        ));
        return retry;
    }

    /**
     * Backoff before retry number {@code attempt} (1-based), jitter included.
     */
    public long delayForAttempt(int attempt) {
        return intervalFunction.apply(Math.max(1, attempt));
    }

    public int maxAttempts() {
        return maxRetries + 1;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Duration getBaseDelay() {
        return baseDelay;
    }

    public double getFactor() {
        return factor;
    }

    public double getJitter() {
        return jitter;
    }
}
