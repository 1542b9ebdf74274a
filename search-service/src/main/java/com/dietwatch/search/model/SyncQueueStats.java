package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record SyncQueueStats(
        long pending,
        @JsonProperty("in_progress") long inProgress,
        long completed,
        long failed,
        @JsonProperty("dead_lettered") long deadLettered
) {

    /**
     * Jobs still waiting for a worker, including failed ones waiting out their backoff.
     */
    @JsonProperty("depth")
    public long depth() {
        return pending + failed;
    }
}
