package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record WriteNotification(@JsonProperty("entity_id") String entityId, long version) {
}
