package com.dietwatch.search.service;

import com.dietwatch.search.exception.BackendTimeoutException;
import com.dietwatch.search.exception.BackendUnavailableException;
import com.dietwatch.search.exception.SearchEngineException;
import com.dietwatch.search.resilience.RetryPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Embeddings from Ollama's {@code /api/embed}. In fast-validation mode a deterministic pseudo-random
 * vector is derived from the text instead, so the pipeline runs without a model server.
 */
@Service
public class OllamaEmbeddingProvider implements EmbeddingProvider {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String ollamaBaseUrl;
    private final String embeddingModel;
    private final int dimensions;
    private final boolean fastValidationMode;
    private final boolean cacheEnabled;
    private final long cacheTtlMillis;
    private final int cacheMaxEntries;
    private final Clock clock;
    private final Retry retry;
    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, CachedEmbedding> embeddingCache = new ConcurrentHashMap<>();

    @Autowired
    public OllamaEmbeddingProvider(
            RestTemplateBuilder restTemplateBuilder,
            ObjectMapper objectMapper,
            @Value("${vector.ollama.base-url:http://ollama:11434}") String ollamaBaseUrl,
            @Value("${vector.embedding.model:embeddinggemma}") String embeddingModel,
            @Value("${vector.embedding.dimensions:768}") int dimensions,
            @Value("${vector.embedding.request-timeout-ms:2000}") long requestTimeoutMs,
            @Value("${vector.embedding.fast-validation-mode:false}") boolean fastValidationMode,
            @Value("${vector.embedding-cache.enabled:true}") boolean cacheEnabled,
            @Value("${vector.embedding-cache.ttl-seconds:600}") long cacheTtlSeconds,
            @Value("${vector.embedding-cache.max-entries:5000}") int cacheMaxEntries,
            Clock clock,
            RetryPolicy retryPolicy,
            MeterRegistry meterRegistry
    ) {
        this(
                restTemplateBuilder
                        .setConnectTimeout(Duration.ofMillis(requestTimeoutMs))
                        .setReadTimeout(Duration.ofMillis(requestTimeoutMs))
                        .build(),
                objectMapper,
                ollamaBaseUrl,
                embeddingModel,
                dimensions,
                fastValidationMode,
                cacheEnabled,
                cacheTtlSeconds,
                cacheMaxEntries,
                clock,
                retryPolicy,
                meterRegistry
        );
    }

    public OllamaEmbeddingProvider(
            RestTemplate restTemplate,
            ObjectMapper objectMapper,
            String ollamaBaseUrl,
            String embeddingModel,
            int dimensions,
            boolean fastValidationMode,
            boolean cacheEnabled,
            long cacheTtlSeconds,
            int cacheMaxEntries,
            Clock clock,
            RetryPolicy retryPolicy,
            MeterRegistry meterRegistry
    ) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.ollamaBaseUrl = ollamaBaseUrl;
        this.embeddingModel = embeddingModel;
        this.dimensions = dimensions;
        this.fastValidationMode = fastValidationMode;
        this.cacheEnabled = cacheEnabled;
        this.cacheTtlMillis = Math.max(1L, cacheTtlSeconds) * 1000L;
        this.cacheMaxEntries = Math.max(100, cacheMaxEntries);
        this.clock = clock;
        this.retry = retryPolicy.toRetry("embedding-provider");
        this.meterRegistry = meterRegistry;
    }

    @Override
    public float[] embed(String text) {
        String input = text == null ? "" : text;
        if (fastValidationMode) {
            return syntheticEmbedding(input, dimensions);
        }
        long now = clock.millis();
        if (cacheEnabled) {
            CachedEmbedding cached = embeddingCache.get(input);
            if (cached != null && cached.expiresAtMillis() > now) {
                incrementCounter("vector_embedding_cache_hit_total");
                return cached.embedding().clone();
            }
            incrementCounter("vector_embedding_cache_miss_total");
        }

        long start = System.nanoTime();
        float[] embedding;
        try {
            embedding = Retry.decorateSupplier(retry, () -> fetchEmbedding(input)).get();
        } finally {
            recordTimer("vector_embedding_latency", start);
        }

        if (cacheEnabled) {
            if (embeddingCache.size() >= cacheMaxEntries) {
                embeddingCache.clear();
            }
            embeddingCache.put(input, new CachedEmbedding(embedding.clone(), now + cacheTtlMillis));
        }
        return embedding;
    }

    @Override
    public int dimensions() {
        return dimensions;
    }

    private float[] fetchEmbedding(String input) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("model", embeddingModel);
        payload.put("input", input);

        String response;
        try {
            response = restTemplate.postForObject(ollamaBaseUrl + "/api/embed", payload, String.class);
        } catch (RestClientResponseException ex) {
            int status = ex.getStatusCode().value();
            if (status == 429 || ex.getStatusCode().is5xxServerError()) {
                throw new BackendUnavailableException("embedding provider answered " + status, ex);
            }
            throw new SearchEngineException("embedding provider rejected the request (" + status + ")", ex);
        } catch (ResourceAccessException ex) {
            if (ex.getCause() instanceof SocketTimeoutException) {
                throw new BackendTimeoutException("embedding provider timed out", ex);
            }
            throw new BackendUnavailableException("embedding provider unreachable: " + ex.getMessage(), ex);
        } catch (RestClientException ex) {
            throw new BackendUnavailableException("embedding provider call failed: " + ex.getMessage(), ex);
        }
        if (response == null || response.isBlank()) {
            throw new BackendUnavailableException("embedding provider returned an empty body");
        }

        JsonNode embeddingNode;
        try {
            JsonNode root = objectMapper.readTree(response);
            embeddingNode = root.path("embedding");
            if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
                // /api/embed shape: { "embeddings": [[...]] }
                JsonNode embeddingsNode = root.path("embeddings");
                if (embeddingsNode.isArray() && !embeddingsNode.isEmpty() && embeddingsNode.get(0).isArray()) {
                    embeddingNode = embeddingsNode.get(0);
                }
            }
        } catch (JsonProcessingException ex) {
            throw new BackendUnavailableException("embedding provider returned malformed JSON", ex);
        }
        if (!embeddingNode.isArray() || embeddingNode.isEmpty()) {
            throw new BackendUnavailableException("embedding provider returned no embedding");
        }
        if (embeddingNode.size() != dimensions) {
            throw new SearchEngineException(
                    "embedding has " + embeddingNode.size() + " dimensions, expected " + dimensions
            );
        }

        float[] vector = new float[embeddingNode.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) embeddingNode.get(i).asDouble();
        }
        return vector;
    }

    public static float[] syntheticEmbedding(String input, int dimensions) {
        long seed = input.hashCode();
        float[] vector = new float[dimensions];
        for (int i = 0; i < dimensions; i++) {
            seed = (seed * 6364136223846793005L) + 1442695040888963407L;
            vector[i] = (float) ((((seed >>> 33) % 2_000_000L) / 1_000_000.0) - 1.0);
        }
        return vector;
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private void incrementCounter(String metricName) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter(metricName).increment();
    }

    private record CachedEmbedding(float[] embedding, long expiresAtMillis) {
    }
}
