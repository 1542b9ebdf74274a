package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record SyncJob(
        long id,
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("requested_version") long requestedVersion,
        @JsonProperty("attempt_count") int attemptCount,
        SyncJobStatus status,
        @JsonProperty("last_error") String lastError,
        @JsonProperty("error_history") List<String> errorHistory,
        @JsonProperty("next_attempt_at") Instant nextAttemptAt,
        @JsonProperty("claimed_at") Instant claimedAt,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt
) {

    public SyncJob {
        errorHistory = errorHistory == null ? List.of() : List.copyOf(errorHistory);
    }
}
