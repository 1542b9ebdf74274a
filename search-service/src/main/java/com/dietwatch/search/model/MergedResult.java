package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record MergedResult(
        @JsonProperty("entity_id") String entityId,
        @JsonProperty("combined_score") double combinedScore,
        @JsonProperty("source") ResultSource source,
        @JsonIgnore double keywordScore,
        @JsonIgnore double vectorScore,
        @JsonIgnore LocalDate date
) {
}
