package com.dietwatch.search.model;

public enum SyncJobStatus {
    PENDING,
    IN_PROGRESS,
    COMPLETED,
    FAILED,
    DEAD_LETTERED;

    public boolean isClaimable() {
        return this == PENDING || this == FAILED;
    }
}
