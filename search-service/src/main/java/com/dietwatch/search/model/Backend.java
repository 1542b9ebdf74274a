package com.dietwatch.search.model;

import java.util.Locale;

public enum Backend {
    KEYWORD,
    VECTOR;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
