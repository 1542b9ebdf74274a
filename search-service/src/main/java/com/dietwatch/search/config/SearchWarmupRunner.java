package com.dietwatch.search.config;

import com.dietwatch.search.service.EmbeddingProvider;
import com.dietwatch.search.service.VectorStoreClient;
import com.dietwatch.search.model.SearchFilters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Loads the embedding model and touches the vector index before traffic arrives. The structured store
 * is left alone so warmup never spends rate-limit permits.
 */
@Component
public class SearchWarmupRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(SearchWarmupRunner.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorStoreClient vectorStoreClient;
    private final boolean warmupEnabled;
    private final String warmupQuery;
    private final int warmupAttempts;
    private final long warmupDelayMs;

    public SearchWarmupRunner(
            EmbeddingProvider embeddingProvider,
            VectorStoreClient vectorStoreClient,
            @Value("${search.warmup.enabled:false}") boolean warmupEnabled,
            @Value("${search.warmup.query:diet session warmup}") String warmupQuery,
            @Value("${search.warmup.attempts:2}") int warmupAttempts,
            @Value("${search.warmup.delay-ms:2000}") long warmupDelayMs
    ) {
        this.embeddingProvider = embeddingProvider;
        this.vectorStoreClient = vectorStoreClient;
        this.warmupEnabled = warmupEnabled;
        this.warmupQuery = warmupQuery;
        this.warmupAttempts = Math.max(1, warmupAttempts);
        this.warmupDelayMs = Math.max(0L, warmupDelayMs);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!warmupEnabled) {
            return;
        }
        for (int attempt = 1; attempt <= warmupAttempts; attempt++) {
            try {
                float[] embedding = embeddingProvider.embed(warmupQuery);
                int hits = vectorStoreClient.nearest(embedding, 1, SearchFilters.none()).size();
                log.info("event=search_warmup_complete attempt={} dimensions={} hits={}", attempt, embedding.length, hits);
                return;
            } catch (RuntimeException ex) {
                log.warn("event=search_warmup_failed attempt={} cause={}", attempt, ex.getMessage());
            }
            if (attempt < warmupAttempts && warmupDelayMs > 0) {
                try {
                    Thread.sleep(warmupDelayMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }
}
