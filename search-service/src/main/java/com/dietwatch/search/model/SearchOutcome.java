package com.dietwatch.search.model;

import java.util.List;

/**
 * Result of a hybrid search: either {@link FullResults} or {@link PartialResults} when one backend
 * could not contribute.
 */
public interface SearchOutcome {

    List<MergedResult> results();

    default boolean degraded() {
        return false;
    }
}
