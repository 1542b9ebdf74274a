package com.dietwatch.search.service;

public interface EmbeddingProvider {

    /**
     * @return a vector of {@link #dimensions()} components
     */
    float[] embed(String text);

    int dimensions();
}
