package com.dietwatch.search.exception;

import java.time.Duration;

/**
 * The upstream answered 429 even though the local limiter let the call through.
 */
public class UpstreamThrottledException extends BackendUnavailableException {

    private final Duration retryAfter;

    public UpstreamThrottledException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter == null ? Duration.ZERO : retryAfter;
    }

    public Duration getRetryAfter() {
        return retryAfter;
    }
}
