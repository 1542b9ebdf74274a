package com.dietwatch.search.service;

import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchFilters;
import com.dietwatch.search.model.VectorRecord;
import com.dietwatch.search.resilience.RetryPolicy;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Vector store access with the shared retry policy. Not rate limited.
 */
@Service
public class VectorStoreClient {
    private static final Logger log = LoggerFactory.getLogger(VectorStoreClient.class);

    private final VectorStoreGateway gateway;
    private final MeterRegistry meterRegistry;
    private final Retry nearestRetry;
    private final Retry writeRetry;

    public VectorStoreClient(VectorStoreGateway gateway, RetryPolicy retryPolicy) {
        this(gateway, retryPolicy, null);
    }

    @Autowired
    public VectorStoreClient(VectorStoreGateway gateway, RetryPolicy retryPolicy, MeterRegistry meterRegistry) {
        this.gateway = gateway;
        this.meterRegistry = meterRegistry;
        this.nearestRetry = retryPolicy.toRetry("vector-store-nearest");
        this.writeRetry = retryPolicy.toRetry("vector-store-write");
    }

    public List<ScoredHit> nearest(float[] embedding, int k, SearchFilters filters) {
        long start = System.nanoTime();
        try {
            return Retry.decorateSupplier(nearestRetry, () -> gateway.nearest(embedding, k, filters)).get();
        } finally {
            recordTimer("vector_store_nearest_latency", start);
        }
    }

    /**
     * @return {@code false} when the store already held an equal or newer version
     */
    public boolean upsert(String entityId, float[] embedding, Map<String, Object> metadata, long sourceVersion) {
        VectorRecord record = new VectorRecord(entityId, embedding, sourceVersion, metadata == null ? Map.of() : metadata);
        boolean written = Retry.decorateSupplier(writeRetry, () -> gateway.upsert(record)).get();
        if (!written) {
            log.info("event=vector_upsert_skipped entity_id={} source_version={} reason=stale", entityId, sourceVersion);
        }
        return written;
    }

    /**
     * Version the vector record was built from, {@code 0} when there is none yet.
     */
    public long sourceVersion(String entityId) {
        return Retry.decorateSupplier(nearestRetry, () -> gateway.sourceVersion(entityId)).get().orElse(0L);
    }

    /**
     * Removes the record of an entity that no longer exists in the structured store.
     */
    public boolean delete(String entityId) {
        boolean deleted = Retry.decorateSupplier(writeRetry, () -> gateway.delete(entityId)).get();
        log.info("event=vector_delete entity_id={} deleted={}", entityId, deleted);
        return deleted;
    }

    private void recordTimer(String metricName, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.timer(metricName).record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }
}
