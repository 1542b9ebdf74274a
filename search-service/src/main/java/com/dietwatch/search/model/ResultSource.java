package com.dietwatch.search.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ResultSource {
    KEYWORD("keyword"),
    VECTOR("vector"),
    BOTH("both");

    private final String label;

    ResultSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
