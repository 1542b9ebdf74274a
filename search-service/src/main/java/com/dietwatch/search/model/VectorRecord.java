package com.dietwatch.search.model;

import java.util.Map;

public record VectorRecord(String entityId, float[] embedding, long sourceVersion, Map<String, Object> metadata) {
}
