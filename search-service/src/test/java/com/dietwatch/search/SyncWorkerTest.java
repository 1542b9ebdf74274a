package com.dietwatch.search;

import com.dietwatch.search.exception.BackendUnavailableException;
import com.dietwatch.search.model.ScoredHit;
import com.dietwatch.search.model.SearchableEntity;
import com.dietwatch.search.model.SyncJob;
import com.dietwatch.search.model.SyncJobStatus;
import com.dietwatch.search.resilience.RetryPolicy;
import com.dietwatch.search.service.EmbeddingProvider;
import com.dietwatch.search.service.ResultCache;
import com.dietwatch.search.service.StructuredStoreClient;
import com.dietwatch.search.service.VectorStoreClient;
import com.dietwatch.search.sync.SyncQueue;
import com.dietwatch.search.sync.SyncWorker;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SyncWorkerTest {

    private final SyncQueue queue = mock(SyncQueue.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T09:00:00Z"));
    private final ResultCache resultCache = new ResultCache(Duration.ofMinutes(5), 100, clock);
    private final List<String> upserts = new ArrayList<>();
    private final List<String> deletes = new ArrayList<>();

    @Test
    void testSyncsEntityAndInvalidatesCachedResults() {
        SearchableEntity entity = new SearchableEntity(
                "E",
                Map.of("Title", "Consumption tax amendment"),
                Map.of("category", "bill", "date", "2025-06-12"),
                3
        );
        resultCache.put("q", List.of(new ScoredHit("E", 1.0), new ScoredHit("F", 0.5)));
        when(queue.claim()).thenReturn(Optional.of(job(3)));
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        SyncWorker worker = worker(Optional.of(entity), 1, registry);

        assertThat(worker.processNext()).isTrue();

        assertThat(upserts).containsExactly("E@3");
        verify(queue).complete(7L);
        verify(queue, never()).fail(anyLong(), anyString());
        assertThat(resultCache.get("q")).isNull();
        assertThat(registry.counter("sync_job_processed_total", "outcome", "completed").count()).isEqualTo(1.0);
    }

    @Test
    void testSkipsWhenVectorRecordIsAlreadyCurrent() {
        SearchableEntity entity = new SearchableEntity("E", Map.of("Title", "text"), Map.of(), 3);
        when(queue.claim()).thenReturn(Optional.of(job(3)));

        worker(Optional.of(entity), 3, null).processNext();

        assertThat(upserts).isEmpty();
        verify(queue).complete(7L);
    }

    @Test
    void testMissingEntityDeletesVectorRecordAndCompletesJob() {
        resultCache.put("q", List.of(new ScoredHit("E", 1.0)));
        when(queue.claim()).thenReturn(Optional.of(job(3)));

        worker(Optional.empty(), 2, null).processNext();

        assertThat(upserts).isEmpty();
        assertThat(deletes).containsExactly("E");
        verify(queue).complete(7L);
        assertThat(resultCache.get("q")).isNull();
    }

    @Test
    void testDeleteFailureFailsJob() {
        when(queue.claim()).thenReturn(Optional.of(job(3)));
        VectorStoreClient vectors = new VectorStoreClient(null, RetryPolicy.defaults()) {
            @Override
            public boolean delete(String entityId) {
                throw new BackendUnavailableException("vector store unavailable");
            }
        };
        EmbeddingProvider embeddings = mock(EmbeddingProvider.class);

        new SyncWorker(queue, store(Optional.empty()), vectors, embeddings, resultCache).processNext();

        verify(queue).fail(eq(7L), contains("vector store unavailable"));
        verify(queue, never()).complete(anyLong());
    }

    @Test
    void testLaggingStoreReadIsRetriedLater() {
        SearchableEntity stale = new SearchableEntity("E", Map.of("Title", "text"), Map.of(), 2);
        when(queue.claim()).thenReturn(Optional.of(job(3)));

        worker(Optional.of(stale), 1, null).processNext();

        assertThat(upserts).isEmpty();
        verify(queue).fail(eq(7L), contains("version 2"));
        verify(queue, never()).complete(anyLong());
    }

    @Test
    void testEmbeddingFailureFailsJob() {
        SearchableEntity entity = new SearchableEntity("E", Map.of("Title", "text"), Map.of(), 3);
        when(queue.claim()).thenReturn(Optional.of(job(3)));
        SyncWorker worker = new SyncWorker(queue, store(Optional.of(entity)), vectors(1), new EmbeddingProvider() {
            @Override
            public float[] embed(String text) {
                throw new BackendUnavailableException("ollama answered 503");
            }

            @Override
            public int dimensions() {
                return 3;
            }
        }, resultCache);

        worker.processNext();

        verify(queue).fail(eq(7L), contains("ollama answered 503"));
    }

    @Test
    void testNothingToClaim() {
        when(queue.claim()).thenReturn(Optional.empty());

        assertThat(worker(Optional.empty(), 0, null).processNext()).isFalse();
    }

    private SyncWorker worker(Optional<SearchableEntity> entity, long sourceVersion, SimpleMeterRegistry registry) {
        EmbeddingProvider embeddings = new EmbeddingProvider() {
            @Override
            public float[] embed(String text) {
                return new float[]{0.1f, 0.2f, 0.3f};
            }

            @Override
            public int dimensions() {
                return 3;
            }
        };
        return new SyncWorker(queue, store(entity), vectors(sourceVersion), embeddings, resultCache, registry, false, 1, 100L);
    }

    private StructuredStoreClient store(Optional<SearchableEntity> entity) {
        return new StructuredStoreClient(null, null, null, RetryPolicy.defaults()) {
            @Override
            public Optional<SearchableEntity> getEntity(String entityId) {
                return entity;
            }
        };
    }

    private VectorStoreClient vectors(long sourceVersion) {
        return new VectorStoreClient(null, RetryPolicy.defaults()) {
            @Override
            public long sourceVersion(String entityId) {
                return sourceVersion;
            }

            @Override
            public boolean upsert(String entityId, float[] embedding, Map<String, Object> metadata, long version) {
                upserts.add(entityId + "@" + version);
                return true;
            }

            @Override
            public boolean delete(String entityId) {
                deletes.add(entityId);
                return true;
            }
        };
    }

    private static SyncJob job(long requestedVersion) {
        Instant now = Instant.parse("2026-03-01T09:00:00Z");
        return new SyncJob(7L, "E", requestedVersion, 0, SyncJobStatus.IN_PROGRESS, null, List.of(), now, now, now, now);
    }
}
