package com.dietwatch.search.model;

import java.util.List;

public record FullResults(List<MergedResult> results) implements SearchOutcome {

    public FullResults {
        results = List.copyOf(results);
    }
}
