package com.dietwatch.search.model;

import java.time.LocalDate;

/**
 * One backend result. {@code date} is the entity's metadata date when the backend knows it; it only
 * matters for tie-breaking.
 */
public record ScoredHit(String entityId, double score, LocalDate date) {

    public ScoredHit(String entityId, double score) {
        this(entityId, score, null);
    }
}
