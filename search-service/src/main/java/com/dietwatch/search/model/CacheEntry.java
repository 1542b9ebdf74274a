package com.dietwatch.search.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record CacheEntry(String querySignature, List<ScoredHit> results, Instant createdAt, Duration ttl) {

    public CacheEntry {
        results = List.copyOf(results);
    }

    public Instant expiresAt() {
        return createdAt.plus(ttl);
    }

    /**
     * An entry is dead from the instant {@code createdAt + ttl} is reached.
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
