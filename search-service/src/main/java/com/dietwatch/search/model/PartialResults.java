package com.dietwatch.search.model;

import java.util.List;

/**
 * Results from the surviving backend only. {@code reason} is the failure of the degraded one.
 */
public record PartialResults(List<MergedResult> results, Backend degradedBackend, String reason)
        implements SearchOutcome {

    public PartialResults {
        results = List.copyOf(results);
    }

    @Override
    public boolean degraded() {
        return true;
    }
}
