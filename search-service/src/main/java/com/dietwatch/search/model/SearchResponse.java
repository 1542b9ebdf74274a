package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResponse {
    private List<MergedResult> results;
    private boolean degraded;
    private String degradedBackend;
    private int page;
    private int pageSize;

    public SearchResponse() {
    }

    public static SearchResponse from(SearchOutcome outcome, int page, int pageSize) {
        SearchResponse response = new SearchResponse();
        response.setResults(outcome.results());
        response.setDegraded(outcome.degraded());
        if (outcome instanceof PartialResults partial) {
            response.setDegradedBackend(partial.degradedBackend().label());
        }
        response.setPage(page);
        response.setPageSize(pageSize);
        return response;
    }

    public List<MergedResult> getResults() {
        return results;
    }

    public void setResults(List<MergedResult> results) {
        this.results = results;
    }

    public boolean isDegraded() {
        return degraded;
    }

    public void setDegraded(boolean degraded) {
        this.degraded = degraded;
    }

    @JsonProperty("degraded_backend")
    public String getDegradedBackend() {
        return degradedBackend;
    }

    public void setDegradedBackend(String degradedBackend) {
        this.degradedBackend = degradedBackend;
    }

    public int getPage() {
        return page;
    }

    public void setPage(int page) {
        this.page = page;
    }

    @JsonProperty("page_size")
    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }
}
