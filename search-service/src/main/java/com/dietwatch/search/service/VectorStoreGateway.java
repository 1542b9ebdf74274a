package com.dietwatch.search.service;

import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.VectorRecord;

import java.util.List;
import java.util.OptionalLong;

public interface VectorStoreGateway {

    List<ScoredHit> nearest(float[] embedding, int k, SearchFilters filters);

    /**
     * Writes the record unless the stored one already has an equal or newer source version.
     *
     * @return {@code true} when the row was inserted or replaced
     */
    boolean upsert(VectorRecord record);

    OptionalLong sourceVersion(String entityId);

    /**
     * @return {@code true} when a record was removed
     */
    boolean delete(String entityId);
}
