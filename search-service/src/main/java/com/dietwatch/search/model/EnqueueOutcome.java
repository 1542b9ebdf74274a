package com.dietwatch.search.model;

public enum EnqueueOutcome {
    ENQUEUED,
    BUMPED,
    ALREADY_QUEUED,
    UP_TO_DATE
}
