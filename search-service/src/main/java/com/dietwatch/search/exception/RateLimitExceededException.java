package com.dietwatch.search.exception;

import java.time.Duration;

public class RateLimitExceededException extends SearchEngineException {

    private final Duration suggestedWait;

    public RateLimitExceededException(String message, Duration suggestedWait) {
        super(message);
        this.suggestedWait = suggestedWait == null ? Duration.ZERO : suggestedWait;
    }

    public Duration getSuggestedWait() {
        return suggestedWait;
    }
}
