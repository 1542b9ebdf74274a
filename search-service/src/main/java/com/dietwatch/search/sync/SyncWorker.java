package com.dietwatch.search.sync;

import com.dietwatch.search.exception.BackendUnavailableException;
import com.dietwatch.search.model.SearchableEntity;
import com.dietwatch.search.model.SyncJob;
import com.dietwatch.search.service.EmbeddingProvider;
import com.dietwatch.search.service.ResultCache;
import com.dietwatch.search.service.StructuredStoreClient;
import com.dietwatch.search.service.VectorStoreClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fixed pool of workers draining the {@link SyncQueue}: fetch the entity, embed its text, upsert the
 * vector record at the entity's version and drop cached keyword results that mention it. An entity
 * gone from the structured store has its vector record deleted.
 */
@Component
public class SyncWorker implements InitializingBean, DisposableBean {
    private static final Logger log = LoggerFactory.getLogger(SyncWorker.class);

    private final SyncQueue syncQueue;
    private final StructuredStoreClient structuredStoreClient;
    private final VectorStoreClient vectorStoreClient;
    private final EmbeddingProvider embeddingProvider;
    private final ResultCache resultCache;
    private final MeterRegistry meterRegistry;
    private final boolean enabled;
    private final int threads;
    private final long idleSleepMs;
    private volatile boolean running;
    private ExecutorService workers;

    public SyncWorker(
            SyncQueue syncQueue,
            StructuredStoreClient structuredStoreClient,
            VectorStoreClient vectorStoreClient,
            EmbeddingProvider embeddingProvider,
            ResultCache resultCache
    ) {
        this(syncQueue, structuredStoreClient, vectorStoreClient, embeddingProvider, resultCache, null, false, 1, 100L);
    }

    @Autowired
    public SyncWorker(
            SyncQueue syncQueue,
            StructuredStoreClient structuredStoreClient,
            VectorStoreClient vectorStoreClient,
            EmbeddingProvider embeddingProvider,
            ResultCache resultCache,
            MeterRegistry meterRegistry,
            @Value("${sync.worker.enabled:true}") boolean enabled,
            @Value("${sync.worker.threads:4}") int threads,
            @Value("${sync.worker.idle-sleep-ms:500}") long idleSleepMs
    ) {
        this.syncQueue = syncQueue;
        this.structuredStoreClient = structuredStoreClient;
        this.vectorStoreClient = vectorStoreClient;
        this.embeddingProvider = embeddingProvider;
        this.resultCache = resultCache;
        this.meterRegistry = meterRegistry;
        this.enabled = enabled;
        this.threads = Math.max(1, threads);
        this.idleSleepMs = Math.max(10L, idleSleepMs);
    }

    @Override
    public void afterPropertiesSet() {
        if (!enabled) {
            log.info("sync worker pool disabled");
            return;
        }
        running = true;
        workers = Executors.newFixedThreadPool(threads, namedThreads());
        for (int i = 0; i < threads; i++) {
            workers.submit(this::runLoop);
        }
        log.info("sync worker pool started threads={}", threads);
    }

    @Override
    public void destroy() throws InterruptedException {
        running = false;
        if (workers != null) {
            workers.shutdownNow();
            if (!workers.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("sync workers did not stop within 10s");
            }
            log.info("sync worker pool stopped");
        }
    }

    /**
     * Claims and processes at most one job.
     *
     * @return {@code false} when nothing was claimable
     */
    public boolean processNext() {
        Optional<SyncJob> claimed = syncQueue.claim();
        if (claimed.isEmpty()) {
            return false;
        }
        process(claimed.get());
        return true;
    }

    @Scheduled(
            initialDelayString = "${sync.maintenance.initial-delay-ms:60000}",
            fixedDelayString = "${sync.maintenance.interval-ms:60000}"
    )
    public void maintain() {
        if (!enabled) {
            return;
        }
        syncQueue.recoverStale();
        syncQueue.purgeCompleted();
    }

    void process(SyncJob job) {
        long start = System.nanoTime();
        try {
            Optional<SearchableEntity> found = structuredStoreClient.getEntity(job.entityId());
            if (found.isEmpty()) {
                log.warn("event=sync_entity_missing job_id={} entity_id={}", job.id(), job.entityId());
                vectorStoreClient.delete(job.entityId());
                syncQueue.complete(job.id());
                resultCache.invalidate(job.entityId());
                recordOutcome("missing", start);
                return;
            }
            SearchableEntity entity = found.get();
            long current = vectorStoreClient.sourceVersion(entity.id());
            if (current >= job.requestedVersion()) {
                log.info(
                        "event=sync_skipped job_id={} entity_id={} requested_version={} source_version={}",
                        job.id(),
                        entity.id(),
                        job.requestedVersion(),
                        current
                );
                syncQueue.complete(job.id());
                recordOutcome("skipped", start);
                return;
            }
            if (entity.version() < job.requestedVersion()) {
                throw new BackendUnavailableException(
                        "structured store returned version " + entity.version() + ", waiting for " + job.requestedVersion()
                );
            }

            float[] embedding = embeddingProvider.embed(entity.concatenatedText());
            vectorStoreClient.upsert(entity.id(), embedding, entity.metadata(), entity.version());
            syncQueue.complete(job.id());
            int invalidated = resultCache.invalidate(entity.id());
            log.info(
                    "event=sync_completed job_id={} entity_id={} source_version={} cache_invalidated={} duration_ms={}",
                    job.id(),
                    entity.id(),
                    entity.version(),
                    invalidated,
                    (System.nanoTime() - start) / 1_000_000.0
            );
            recordOutcome("completed", start);
        } catch (RuntimeException ex) {
            syncQueue.fail(job.id(), ex.toString());
            recordOutcome("failed", start);
        }
    }

    private void runLoop() {
        while (running && !Thread.currentThread().isInterrupted()) {
            boolean worked;
            try {
                worked = processNext();
            } catch (RuntimeException ex) {
                log.warn("event=sync_claim_failed cause={}", ex.toString());
                worked = false;
            }
            if (!worked) {
                try {
                    Thread.sleep(idleSleepMs);
                } catch (InterruptedException ex) {
                    Thread.currentThread().interrupt();
                    return;
                }
            }
        }
    }

    private void recordOutcome(String outcome, long startNanos) {
        if (meterRegistry == null) {
            return;
        }
        meterRegistry.counter("sync_job_processed_total", "outcome", outcome).increment();
        meterRegistry.timer("sync_job_duration", "outcome", outcome)
                .record(System.nanoTime() - startNanos, TimeUnit.NANOSECONDS);
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "sync-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
