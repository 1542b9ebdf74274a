package com.dietwatch.search.model;

public record CacheStats(
        int size,
        long hits,
        long misses,
        long evictions,
        long invalidations,
        long expirations,
        long ttlSeconds,
        int maxEntries
) {
}
