package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

public class SearchFilters {
    private String category;
    private String status;
    private String dateFrom;
    private String dateTo;
    private final Map<String, Object> unknown = new LinkedHashMap<>();

    public SearchFilters() {
    }

    public SearchFilters(String category, String status, String dateFrom, String dateTo) {
        this.category = category;
        this.status = status;
        this.dateFrom = dateFrom;
        this.dateTo = dateTo;
    }

    public static SearchFilters none() {
        return new SearchFilters();
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    @JsonProperty("date_from")
    public String getDateFrom() {
        return dateFrom;
    }

    @JsonProperty("date_from")
    public void setDateFrom(String dateFrom) {
        this.dateFrom = dateFrom;
    }

    @JsonProperty("date_to")
    public String getDateTo() {
        return dateTo;
    }

    @JsonProperty("date_to")
    public void setDateTo(String dateTo) {
        this.dateTo = dateTo;
    }

    @JsonAnySetter
    public void putUnknown(String key, Object value) {
        unknown.put(key, value);
    }

    @JsonIgnore
    public Map<String, Object> getUnknown() {
        return unknown;
    }

    /**
     * Populated filters keyed by their wire names, sorted so equal filter sets produce equal keys.
     */
    @JsonIgnore
    public Map<String, String> asSortedMap() {
        Map<String, String> sorted = new TreeMap<>();
        putIfPresent(sorted, "category", category);
        putIfPresent(sorted, "date_from", dateFrom);
        putIfPresent(sorted, "date_to", dateTo);
        putIfPresent(sorted, "status", status);
        return sorted;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return asSortedMap().isEmpty();
    }

    private static void putIfPresent(Map<String, String> target, String key, String value) {
        if (value != null && !value.isBlank()) {
            target.put(key, value.trim());
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SearchFilters other)) {
            return false;
        }
        return asSortedMap().equals(other.asSortedMap());
    }

    @Override
    public int hashCode() {
        return Objects.hash(asSortedMap());
    }

    @Override
    public String toString() {
        return asSortedMap().toString();
    }
}
